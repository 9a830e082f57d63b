package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.Map;

/**
 * Response DTO for the unlockIndex tool.
 *
 * @param lockFileExisted whether a {@code write.lock} was found and removed
 * @param writerActive    whether a writer held the lock at the time of the call
 */
public record UnlockIndexResponse(
        boolean success,
        String root,
        String lockFilePath,
        Boolean lockFileExisted,
        Boolean writerActive,
        String message,
        Map<String, Object> error
) {

    public static UnlockIndexResponse removed(final String root, final String lockFilePath, final boolean writerActive) {
        final String message = writerActive
                ? "Lock file removed while a writer held it. Re-run indexDirectory once that writer is gone."
                : "Stale lock file removed.";
        return new UnlockIndexResponse(true, root, lockFilePath, true, writerActive, message, null);
    }

    public static UnlockIndexResponse noLockFile(final String root, final String lockFilePath) {
        return new UnlockIndexResponse(true, root, lockFilePath, false, false, "No lock file present.", null);
    }

    public static UnlockIndexResponse error(final Map<String, Object> error) {
        return new UnlockIndexResponse(false, null, null, null, null, null, error);
    }
}
