package org.buaa.imagesearch.ingest;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 任务状态，只允许前进：queued → running → completed | failed | cancelled，queued 也可直接失败或取消
 */
public enum JobStatus {

    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        switch (this) {
            case QUEUED:
                return next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING:
                return next == COMPLETED || next == FAILED || next == CANCELLED;
            default:
                return false;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
