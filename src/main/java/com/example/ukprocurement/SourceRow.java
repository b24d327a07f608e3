package com.example.ukprocurement;

import lombok.Value;

/**
 * Откуда пришел релиз: дневной CSV-список Contracts Finder, номер строки и URI пакета
 */
@Value
public class SourceRow {
    String csvFile;
    long rowIndex;
    String uri;
}
