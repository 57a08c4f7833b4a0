package com.jay.carbonscore.layer1_data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.carbonscore.model.CompanyData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads questionnaire JSON into {@link CompanyData}.
 * <pre>
 * {
 *   "company":   { "name", "sector", "employee_band", "revenue" },
 *   "energy":    { "electricity_kwh", "gas_kwh", "fuel_litres" },
 *   "transport": { "vehicle_km", "domestic_flight_km", "international_flight_km" },
 *   "purchases": { "annual_amount", "local_pct" }
 * }
 * </pre>
 * Absent or non-numeric quantities read as 0; an absent revenue stays null.
 */
@Slf4j
@Component
public class QuestionnaireParser {

    private final ObjectMapper mapper = new ObjectMapper();

    public CompanyData parse(String json) {
        if (json == null || json.isBlank()) {
            throw new QuestionnaireParseException("Questionnaire is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QuestionnaireParseException("Questionnaire is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new QuestionnaireParseException("Questionnaire root must be a JSON object");
        }

        JsonNode company   = root.path("company");
        JsonNode energy    = root.path("energy");
        JsonNode transport = root.path("transport");
        JsonNode purchases = root.path("purchases");

        CompanyData data = CompanyData.builder()
            .companyName(text(company, "name"))
            .sector(text(company, "sector"))
            .employeeBand(text(company, "employee_band"))
            .revenue(optionalNumber(company, "revenue"))
            .electricityKwh(number(energy, "electricity_kwh"))
            .gasKwh(number(energy, "gas_kwh"))
            .fuelLitres(number(energy, "fuel_litres"))
            .vehicleKm(number(transport, "vehicle_km"))
            .domesticFlightKm(number(transport, "domestic_flight_km"))
            .internationalFlightKm(number(transport, "international_flight_km"))
            .purchaseAmount(number(purchases, "annual_amount"))
            .localSourcingPct(number(purchases, "local_pct"))
            .build();
        log.debug("Parsed questionnaire for '{}' (sector={}, band={})",
            data.getCompanyName(), data.getSector(), data.getEmployeeBand());
        return data;
    }

    private static String text(JsonNode parent, String field) {
        JsonNode n = parent.path(field);
        return n.isMissingNode() || n.isNull() ? null : n.asText();
    }

    private static double number(JsonNode parent, String field) {
        return parent.path(field).asDouble(0);
    }

    private static Double optionalNumber(JsonNode parent, String field) {
        JsonNode n = parent.path(field);
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual() && !n.asText().isBlank()) {
            double v = n.asDouble(Double.NaN);
            return Double.isNaN(v) ? null : v;
        }
        return null;
    }
}
