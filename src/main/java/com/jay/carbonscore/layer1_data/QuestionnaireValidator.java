package com.jay.carbonscore.layer1_data;

import com.jay.carbonscore.model.CompanyData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks a questionnaire before calculation.
 * Errors make the input unusable (negative quantities, local share outside 0-100);
 * warnings and suggestions are informational.
 */
@Slf4j
@Component
public class QuestionnaireValidator {

    private static final double HIGH_VEHICLE_KM = 100_000;
    private static final double HIGH_LOCAL_PCT = 80;

    public record ValidationReport(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        List<String> suggestions
    ) {}

    public ValidationReport validate(CompanyData data) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        // ── Quantities must be finite and non-negative ───────────────────────
        checkQuantity(errors, "electricity_kwh", data.getElectricityKwh());
        checkQuantity(errors, "gas_kwh", data.getGasKwh());
        checkQuantity(errors, "fuel_litres", data.getFuelLitres());
        checkQuantity(errors, "vehicle_km", data.getVehicleKm());
        checkQuantity(errors, "domestic_flight_km", data.getDomesticFlightKm());
        checkQuantity(errors, "international_flight_km", data.getInternationalFlightKm());
        checkQuantity(errors, "purchase_amount", data.getPurchaseAmount());
        if (data.getRevenue() != null) {
            checkQuantity(errors, "revenue", data.getRevenue());
        }

        // ── Local sourcing share ─────────────────────────────────────────────
        double local = data.getLocalSourcingPct();
        if (!Double.isFinite(local) || local < 0 || local > 100) {
            errors.add(String.format(Locale.ROOT, "local_pct must be between 0 and 100, got %s", local));
        }

        // ── Data quality ─────────────────────────────────────────────────────
        if (data.getElectricityKwh() == 0 && data.getGasKwh() == 0) {
            warnings.add("No energy consumption declared — results may be incomplete");
        }
        if (data.getVehicleKm() > HIGH_VEHICLE_KM) {
            suggestions.add(String.format(Locale.ROOT, "Vehicle mileage of %.0f km is high — please check the input",
                data.getVehicleKm()));
        }
        if (local > HIGH_LOCAL_PCT && local <= 100) {
            suggestions.add("Excellent local sourcing rate — keep it up");
        }

        if (!errors.isEmpty()) {
            log.info("Questionnaire validation FAILED for '{}' — {} errors: {}",
                data.getCompanyName(), errors.size(), String.join("; ", errors));
        }
        return new ValidationReport(errors.isEmpty(), errors, warnings, suggestions);
    }

    private static void checkQuantity(List<String> errors, String field, double value) {
        if (!Double.isFinite(value) || value < 0) {
            errors.add(String.format(Locale.ROOT, "%s must be a non-negative number, got %s", field, value));
        }
    }
}
