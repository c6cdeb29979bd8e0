package org.projectstate.http;

/**
 * A response read off the wire with {@link DefaultHttpHandler#readRawResponse},
 * split into status code, header block and body.
 */
public record RawHttpResponse(int status, String headerBlock, String body) {

    private static final int STATUS_UNKNOWN = -1;

    public static RawHttpResponse parse(String raw) {
        int headEnd = raw.indexOf("\r\n\r\n");
        String head = headEnd >= 0 ? raw.substring(0, headEnd) : raw;
        String body = headEnd >= 0 ? raw.substring(headEnd + 4) : "";
        return new RawHttpResponse(statusCodeOf(statusLineOf(head)), head, body);
    }

    /** Finds a header value by name (case-insensitive), or {@code null}. */
    public String header(String name) {
        for (String line : headerBlock.split("\r\n")) {
            int i = line.indexOf(':');
            if (i > 0 && line.substring(0, i).trim().equalsIgnoreCase(name)) {
                return line.substring(i + 1).trim();
            }
        }
        return null;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    private static String statusLineOf(String head) {
        int i = head.indexOf("\r\n");
        return (i >= 0) ? head.substring(0, i) : head;
    }

    /** Parses the numeric status or returns -1 if the status line is malformed. */
    private static int statusCodeOf(String statusLine) {
        String[] parts = statusLine.split(" ");
        if (parts.length >= 2) {
            try {
                return Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                return STATUS_UNKNOWN;
            }
        }
        return STATUS_UNKNOWN;
    }
}
