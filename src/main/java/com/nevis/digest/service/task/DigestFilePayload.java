package com.nevis.digest.service.task;

/**
 * @param reset when true all digests of the file go back to {@code todo} before processing
 */
public record DigestFilePayload(String filePath, boolean reset) implements TaskPayload {

    @Override
    public TaskType type() {
        return TaskType.DIGEST_FILE;
    }
}
