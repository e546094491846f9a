package packagetracker.data;

import java.time.OffsetDateTime;

public class Package {
    private long packageId;
    private String trackingNumber;
    private String carrier;
    private int carrierCode;
    private String description;
    private String status;
    private String lastEvent;
    private String lastEventDate;
    private OffsetDateTime lastChecked;
    private OffsetDateTime deliveredDate;
    private String rawResponse;
    private boolean registered;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private boolean active;

    public Package() {
    }

    /**
     * Creates a package that has not been saved yet. It starts active and in the {@code pending} state.
     */
    public Package(String trackingNumber, String carrier, int carrierCode, String description, OffsetDateTime createdAt) {
        this.trackingNumber = trackingNumber;
        this.carrier = carrier;
        this.carrierCode = carrierCode;
        this.description = description;
        this.status = TrackingStatus.PENDING_LABEL;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.active = true;
    }

    // Getters and Setters
    public long getPackageId() {
        return packageId;
    }

    public void setPackageId(long packageId) {
        this.packageId = packageId;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public void setTrackingNumber(String trackingNumber) {
        this.trackingNumber = trackingNumber;
    }

    public String getCarrier() {
        return carrier;
    }

    public void setCarrier(String carrier) {
        this.carrier = carrier;
    }

    public int getCarrierCode() {
        return carrierCode;
    }

    public void setCarrierCode(int carrierCode) {
        this.carrierCode = carrierCode;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getLastEvent() {
        return lastEvent;
    }

    public void setLastEvent(String lastEvent) {
        this.lastEvent = lastEvent;
    }

    public String getLastEventDate() {
        return lastEventDate;
    }

    public void setLastEventDate(String lastEventDate) {
        this.lastEventDate = lastEventDate;
    }

    public OffsetDateTime getLastChecked() {
        return lastChecked;
    }

    public void setLastChecked(OffsetDateTime lastChecked) {
        this.lastChecked = lastChecked;
    }

    public OffsetDateTime getDeliveredDate() {
        return deliveredDate;
    }

    public void setDeliveredDate(OffsetDateTime deliveredDate) {
        this.deliveredDate = deliveredDate;
    }

    public String getRawResponse() {
        return rawResponse;
    }

    public void setRawResponse(String rawResponse) {
        this.rawResponse = rawResponse;
    }

    public boolean isRegistered() {
        return registered;
    }

    public void setRegistered(boolean registered) {
        this.registered = registered;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
