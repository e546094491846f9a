package packagetracker.manager;

import packagetracker.data.Package;
import packagetracker.data.TrackingEvent;

import java.util.List;

public record PackageDetails(Package trackedPackage, List<TrackingEvent> events, String trackingUrl) {
}
