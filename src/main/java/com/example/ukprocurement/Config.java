package com.example.ukprocurement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

public class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final Properties properties = new Properties();
    private static final String CONFIG_FILE = "application.properties";

    static {
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is == null) {
                throw new IOException("Resource not found: " + CONFIG_FILE);
            }
            properties.load(is);
        } catch (IOException e) {
            logger.error("Error loading config: {}", e.getMessage());
        }
    }

    public static boolean getParserVerbose() {
        return Boolean.parseBoolean(properties.getProperty("parser.verbose", "false"));
    }

    /**
     * Кодировка, в которую откатываемся, если XML не читается как UTF-8
     */
    public static Charset getFallbackCharset() {
        String name = properties.getProperty("decoder.fallbackCharset", "ISO-8859-1");
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown fallback charset '{}', using ISO-8859-1", name);
            return StandardCharsets.ISO_8859_1;
        }
    }

    /**
     * Предельная глубина вложенности элементов; более глубокий документ считается битым
     */
    public static int getMaxElementDepth() {
        String value = properties.getProperty("parser.maxElementDepth", "1000");
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid parser.maxElementDepth '{}', using 1000", value);
            return 1000;
        }
    }

    public static String getArchiveEntrySuffix() {
        return properties.getProperty("archive.entrySuffix", ".xml");
    }
}
