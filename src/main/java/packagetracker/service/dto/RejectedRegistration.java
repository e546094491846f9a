package packagetracker.service.dto;

public record RejectedRegistration(String number, int errorCode, String errorMessage) {

    public static final int ALREADY_REGISTERED = -18010012;

    public boolean isAlreadyRegistered() {
        return errorCode == ALREADY_REGISTERED;
    }
}
