package io.b2mash.mailflow.dispatch;

import java.util.List;

public record BulkDispatchResult(int totalSent, int totalFailed, List<String> failedRecipients) {}
