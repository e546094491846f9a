package packagetracker.manager;

public enum FailureReason {
    INVALID_INPUT,
    ALREADY_TRACKED,
    ALREADY_INACTIVE,
    NOT_FOUND,
    QUOTA_EXCEEDED,
    REMOTE_REJECTED,
    STORAGE_ERROR
}
