package org.dpg.jobprocessor.service.iiif;

/**
 * Location of a master file's JP2 derivative in the IIIF bucket. The numeric part of the PID is
 * split into two-digit directories: {@code tsm:12345} lives at {@code tsm/12/34/5/12345.jp2}.
 */
public record IiifKey(String prefix, String fileName) {

    public static IiifKey forPid(final String pid) {
        final int colon = pid.indexOf(':');
        if (colon <= 0 || colon == pid.length() - 1) {
            throw new IllegalArgumentException("Not a namespaced PID: " + pid);
        }
        final String namespace = pid.substring(0, colon);
        String base = pid.substring(colon + 1);
        final String fileName = base + ".jp2";

        final StringBuilder prefix = new StringBuilder(namespace);
        while (base.length() > 2) {
            prefix.append('/').append(base, 0, 2);
            base = base.substring(2);
        }
        if (!base.isEmpty()) {
            prefix.append('/').append(base);
        }
        return new IiifKey(prefix.toString(), fileName);
    }

    public String s3Key() {
        return prefix + "/" + fileName;
    }
}
