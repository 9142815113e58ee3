package com.vgen.archive;

/** Stable, non-cryptographic identifiers for archive file names. */
public final class ArchiveHash {

    private ArchiveHash() {
    }

    /** djb2 over UTF-16 code units with 64-bit wrap-around; the absolute value in decimal. */
    public static String djb2(String s) {
        long hash = 5381;
        for (int i = 0; i < s.length(); i++) {
            hash = (hash << 5) + hash + s.charAt(i);
        }
        return hash == Long.MIN_VALUE ? Long.toUnsignedString(hash) : Long.toString(Math.abs(hash));
    }

    /** Hash of {@code <sequenceId>:<messageId>:<contentKey>}; a missing key hashes as {@code unknown.key}. */
    public static String forTarget(ArchiveTarget target) {
        String key = target.contentKey() != null ? target.contentKey() : "unknown.key";
        return djb2(target.sequenceId() + ":" + target.messageId() + ":" + key);
    }
}
