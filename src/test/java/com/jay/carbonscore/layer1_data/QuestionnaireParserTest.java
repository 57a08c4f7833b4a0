package com.jay.carbonscore.layer1_data;

import com.jay.carbonscore.model.CompanyData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionnaireParserTest {

    private final QuestionnaireParser parser = new QuestionnaireParser();

    @Test
    void parsesAllSections() {
        String json = """
            {
              "company":   { "name": "Boulangerie Martin", "sector": "restauration",
                             "employee_band": "10-49", "revenue": 850000 },
              "energy":    { "electricity_kwh": 42000, "gas_kwh": 18000, "fuel_litres": 1200 },
              "transport": { "vehicle_km": 15000, "domestic_flight_km": 2000,
                             "international_flight_km": 0 },
              "purchases": { "annual_amount": 120000, "local_pct": 65 }
            }
            """;

        CompanyData data = parser.parse(json);

        assertThat(data.getCompanyName()).isEqualTo("Boulangerie Martin");
        assertThat(data.getSector()).isEqualTo("restauration");
        assertThat(data.getEmployeeBand()).isEqualTo("10-49");
        assertThat(data.getRevenue()).isEqualTo(850_000.0);
        assertThat(data.getElectricityKwh()).isEqualTo(42_000);
        assertThat(data.getGasKwh()).isEqualTo(18_000);
        assertThat(data.getFuelLitres()).isEqualTo(1_200);
        assertThat(data.getVehicleKm()).isEqualTo(15_000);
        assertThat(data.getDomesticFlightKm()).isEqualTo(2_000);
        assertThat(data.getInternationalFlightKm()).isZero();
        assertThat(data.getPurchaseAmount()).isEqualTo(120_000);
        assertThat(data.getLocalSourcingPct()).isEqualTo(65);
    }

    @Test
    void absentNumbersDefaultToZeroAndRevenueToNull() {
        CompanyData data = parser.parse("""
            { "company": { "sector": "services" }, "energy": { "electricity_kwh": 10000 } }
            """);

        assertThat(data.getElectricityKwh()).isEqualTo(10_000);
        assertThat(data.getGasKwh()).isZero();
        assertThat(data.getVehicleKm()).isZero();
        assertThat(data.getPurchaseAmount()).isZero();
        assertThat(data.getRevenue()).isNull();
        assertThat(data.getCompanyName()).isNull();
    }

    @Test
    void numericStringsAreAccepted() {
        CompanyData data = parser.parse("""
            { "company": { "revenue": "120000" }, "energy": { "gas_kwh": "5000" } }
            """);

        assertThat(data.getRevenue()).isEqualTo(120_000.0);
        assertThat(data.getGasKwh()).isEqualTo(5_000);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> parser.parse("{ \"company\": "))
            .isInstanceOf(QuestionnaireParseException.class)
            .hasMessageContaining("not valid JSON");
    }

    @Test
    void rejectsNonObjectRoot() {
        assertThatThrownBy(() -> parser.parse("[1, 2, 3]"))
            .isInstanceOf(QuestionnaireParseException.class)
            .hasMessageContaining("JSON object");
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> parser.parse("  "))
            .isInstanceOf(QuestionnaireParseException.class);
    }
}
