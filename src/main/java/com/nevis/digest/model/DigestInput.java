package com.nevis.digest.model;

/**
 * What a digester produced for one of its outputs.
 */
public record DigestInput(
    String digester,
    DigestStatus status,
    String content,
    String archiveName,
    byte[] archiveData,
    String error
) {

    public static DigestInput completed(String digester, String content) {
        return new DigestInput(digester, DigestStatus.COMPLETED, content, null, null, null);
    }

    public static DigestInput completedWithArchive(String digester, String archiveName, byte[] archiveData) {
        return new DigestInput(digester, DigestStatus.COMPLETED, null, archiveName, archiveData, null);
    }
}
