package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the unlockIndex tool. Nothing is removed unless {@code confirm} is {@code true}.
 */
public record UnlockIndexRequest(
        @Description("Absolute path of the indexed directory whose write.lock should be removed.")
        String root,
        @Nullable
        @Description("Pass true to remove the lock. Only do so when no indexDirectory run for this root is in progress.")
        Boolean confirm
) {

    public static UnlockIndexRequest fromMap(final Map<String, Object> args) {
        return new UnlockIndexRequest((String) args.get("root"), (Boolean) args.get("confirm"));
    }

    public boolean isConfirmed() {
        return Boolean.TRUE.equals(confirm);
    }
}
