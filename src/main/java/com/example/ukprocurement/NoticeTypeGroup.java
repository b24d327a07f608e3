package com.example.ukprocurement;

/**
 * Смысловая группа уведомления
 */
public enum NoticeTypeGroup {
    /** предварительное информационное уведомление */
    PIN,
    CONTRACT_NOTICE,
    CONTRACT_AWARD,
    MODIFICATION,
    PLANNING,
    OTHER
}
