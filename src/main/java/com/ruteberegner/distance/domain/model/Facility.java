package com.ruteberegner.distance.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A receiving facility that can be referenced by its short identifier instead of a full address.
 */
@Entity
@Table(name = "facility", indexes = {
        @Index(name = "idx_facility_facility_id", columnList = "facility_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
public class Facility {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "facility_id", nullable = false, length = 32)
    private String facilityId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "street", nullable = false)
    private String street;

    @Column(name = "postal_code", length = 16)
    private String postalCode;

    @Column(name = "city")
    private String city;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public Facility(String facilityId, String name, String street, String postalCode, String city) {
        this.facilityId = facilityId;
        this.name = name;
        this.street = street;
        this.postalCode = postalCode;
        this.city = city;
        this.createdAt = OffsetDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    /**
     * Full postal address in the {@code "street, postalCode city"} form used for geocoding.
     * Missing parts are left out.
     */
    public String getFullAddress() {
        String streetPart = street == null ? "" : street.trim();
        String postalPart = postalCode == null ? "" : postalCode.trim();
        String cityPart = city == null ? "" : city.trim();
        String locality = (postalPart + " " + cityPart).trim();
        if (streetPart.isEmpty()) {
            return locality;
        }
        return locality.isEmpty() ? streetPart : streetPart + ", " + locality;
    }
}
