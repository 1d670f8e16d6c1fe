package com.zzf.simon.client.tool;

import java.util.concurrent.CompletableFuture;

/**
 * Asks the user to approve a pending run. Cancelling the returned future (the app went to the background,
 * the sheet was dismissed) leaves the run pending so it can be resumed later.
 */
@FunctionalInterface
public interface ToolConfirmation {
    CompletableFuture<Decision> confirm(PendingToolRun run);
}
