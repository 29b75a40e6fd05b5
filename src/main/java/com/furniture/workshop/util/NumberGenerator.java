package com.furniture.workshop.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Human readable document numbers: prefix, date and a random three digit
 * suffix, e.g. {@code N-20240315-042}. Not guaranteed unique.
 */
public final class NumberGenerator {

    public static final String ORDER_PREFIX = "N";
    public static final String OFFER_PREFIX = "P";
    public static final String WORK_ORDER_PREFIX = "RN";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private NumberGenerator() {
    }

    public static String next(String prefix, LocalDate date) {
        int suffix = ThreadLocalRandom.current().nextInt(1000);
        return String.format("%s-%s-%03d", prefix, date.format(DATE), suffix);
    }
}
