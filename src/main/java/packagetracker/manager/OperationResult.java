package packagetracker.manager;

public record OperationResult(boolean ok, FailureReason failure, String message) {

    public static OperationResult success(String message) {
        return new OperationResult(true, null, message);
    }

    public static OperationResult failure(FailureReason failure, String message) {
        return new OperationResult(false, failure, message);
    }
}
