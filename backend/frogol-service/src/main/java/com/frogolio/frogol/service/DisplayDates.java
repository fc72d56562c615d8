package com.frogolio.frogol.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Human readable timestamps for dashboard rows, e.g. "Aug 07, 2025 at 03:15 PM"
 */
public final class DisplayDates {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("MMM dd, yyyy 'at' hh:mm a", Locale.US);

    private DisplayDates() {
    }

    public static String format(LocalDateTime dateTime) {
        return dateTime == null ? "" : FORMAT.format(dateTime);
    }
}
