package etl.engine.query.ast;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * project|dataset|start_date|end_date|longitude|latitude|scale
 */
public record RemoteDescriptor(
    String project,
    String dataset,
    LocalDate startDate,
    LocalDate endDate,
    double longitude,
    double latitude,
    double scale
) {
    public static final int FIELD_COUNT = 7;

    /**
     * @throws IllegalArgumentException when the descriptor is malformed
     */
    public static RemoteDescriptor parse(String path) {
        String[] parts = path.split("\\|", -1);
        if (parts.length != FIELD_COUNT) {
            throw new IllegalArgumentException("Remote descriptor needs " + FIELD_COUNT + " '|'-separated fields but got " + parts.length);
        }
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
            if (parts[i].isEmpty()) throw new IllegalArgumentException("Remote descriptor field " + i + " is empty");
        }
        LocalDate start = date(parts[2], "start_date");
        LocalDate end = date(parts[3], "end_date");
        if (end.isBefore(start)) throw new IllegalArgumentException("end_date " + end + " is before start_date " + start);
        return new RemoteDescriptor(parts[0], parts[1], start, end,
            decimal(parts[4], "longitude"), decimal(parts[5], "latitude"), decimal(parts[6], "scale"));
    }

    private static LocalDate date(String raw, String field) {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + field + " '" + raw + "', expected yyyy-MM-dd", e);
        }
    }

    private static double decimal(String raw, String field) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + field + " '" + raw + "', expected a decimal number", e);
        }
    }
}
