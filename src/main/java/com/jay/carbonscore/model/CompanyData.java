package com.jay.carbonscore.model;

import lombok.Builder;
import lombok.Value;

/**
 * One questionnaire snapshot. Quantities are annual; absent numbers are 0.
 */
@Value
@Builder(toBuilder = true)
public class CompanyData {

    private String companyName;
    private String sector;            // sector code, e.g. "services", "logistics"
    private String employeeBand;      // "1-9", "10-49", "50-249", "250+"
    private Double revenue;           // € per year, null when not declared

    // Energy
    private double electricityKwh;
    private double gasKwh;
    private double fuelLitres;

    // Transport
    private double vehicleKm;
    private double domesticFlightKm;
    private double internationalFlightKm;

    // Purchases
    private double purchaseAmount;    // € per year
    private double localSourcingPct;  // 0 - 100
}
