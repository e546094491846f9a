package packagetracker.data;

/**
 * Identity of a tracking event within one package. The provider sends no event ids, so the date and
 * description together decide whether an event has been seen before.
 */
public record EventKey(String eventDate, String description) {
}
