package com.labscheduler.exception;

/**
 * A malformed time label or an unrecognized cell value.
 *
 * Carries enough context (source file, row, column label, staff name) for the
 * caller to decide whether to skip the offending cell or abort the import.
 * Every context field is optional.
 */
public class InputParseException extends SchedulerException {

    private final String reason;
    private final String source;
    private final Integer row;
    private final String column;
    private final String staffName;

    public InputParseException(String message) {
        this(message, null, null, null, null, null);
    }

    public InputParseException(String message, Throwable cause) {
        this(message, null, null, null, null, cause);
    }

    public InputParseException(String message, String source, Integer row, String column, String staffName) {
        this(message, source, row, column, staffName, null);
    }

    public InputParseException(String message, String source, Integer row, String column, String staffName,
                               Throwable cause) {
        super(describe(message, source, row, column, staffName), cause);
        this.reason = message;
        this.source = source;
        this.row = row;
        this.column = column;
        this.staffName = staffName;
    }

    /**
     * Returns a copy of this error enriched with the location it was found at.
     * Fields already set are kept.
     */
    public InputParseException at(String source, Integer row, String column, String staffName) {
        return new InputParseException(reason,
            this.source != null ? this.source : source,
            this.row != null ? this.row : row,
            this.column != null ? this.column : column,
            this.staffName != null ? this.staffName : staffName,
            getCause());
    }

    private static String describe(String message, String source, Integer row, String column, String staffName) {
        StringBuilder sb = new StringBuilder(message);
        if (source != null || row != null || column != null || staffName != null) {
            sb.append(" [");
            String sep = "";
            if (source != null) { sb.append("file=").append(source); sep = ", "; }
            if (row != null) { sb.append(sep).append("row=").append(row); sep = ", "; }
            if (column != null) { sb.append(sep).append("column='").append(column).append('\''); sep = ", "; }
            if (staffName != null) { sb.append(sep).append("staff='").append(staffName).append('\''); }
            sb.append(']');
        }
        return sb.toString();
    }

    /** The message without the location suffix. */
    public String getReason() { return reason; }

    public String getSource() { return source; }

    public Integer getRow() { return row; }

    public String getColumn() { return column; }

    public String getStaffName() { return staffName; }
}
