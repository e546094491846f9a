package packagetracker.service.dto;

/**
 * @param carrierCode carrier the provider resolved the number to, 0 when it did not say
 */
public record AcceptedRegistration(String number, int carrierCode) {
}
