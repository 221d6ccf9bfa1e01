package com.labsignal.reasoning.service;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;

/**
 * Integration tests for the signal evaluation endpoints.
 */
@QuarkusTest
class SignalsResourceTest {

    private static final String ANEMIA_READINGS = """
            {"readings": [
              {"canonical_name": "Hemoglobin", "value": 9.5, "unit": "g/dL"},
              {"canonical_name": "Hematocrit", "value": 28.0, "unit": "%"}
            ]}
            """;

    @Test
    @DisplayName("POST /signals returns findings, conditions and actions")
    void evaluate() {
        given()
                .contentType(ContentType.JSON)
                .body(ANEMIA_READINGS)
                .when().post("/signals")
                .then()
                .statusCode(200)
                .body("findings.id", contains("F001"))
                .body("findings[0].severity", equalTo("medium"))
                .body("conditions.id", contains("C001"))
                .body("conditions[0].why_linked", equalTo("Based on findings: F001"))
                .body("findings[0].confidence", equalTo(0.85f))
                .body("conditions[0].confidence", equalTo(0.7f))
                .body("actions", empty());
    }

    @Test
    @DisplayName("POST /signals surfaces critical actions for severe anemia")
    void severeAnemia() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"readings": [{"canonical_name": "Hemoglobin", "value": 6.0, "unit": "g/dL"}],
                         "patient": {"age": 40, "sex_at_birth": "male",
                                     "symptoms": ["fatigue", "shortness_of_breath"]}}
                        """)
                .when().post("/signals")
                .then()
                .statusCode(200)
                .body("findings.id", contains("F011"))
                .body("conditions.id", contains("C007", "C001"))
                .body("actions.id", contains("A002"))
                .body("actions[0].priority", equalTo("critical"));
    }

    @Test
    @DisplayName("POST /signals returns an empty bundle for unknown tests")
    void unknownTest() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"readings": [{"canonical_name": "NonExistentTest", "value": 100, "unit": "units"}]}
                        """)
                .when().post("/signals")
                .then()
                .statusCode(200)
                .body("findings", empty())
                .body("conditions", empty())
                .body("actions", empty());
    }

    @Test
    @DisplayName("POST /signals rejects an inconsistent patient profile")
    void invalidProfile() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"readings": [{"canonical_name": "Hemoglobin", "value": 11.0, "unit": "g/dL"}],
                         "patient": {"age": 150, "sex_at_birth": "male", "pregnancy_status": "pregnant",
                                     "symptoms": ["none"]}}
                        """)
                .when().post("/signals")
                .then()
                .statusCode(400)
                .body("violations", hasSize(2))
                .body("violations", hasItem("patient: age must be between 0 and 120, got 150"))
                .body("violations",
                        hasItem("patient: pregnancy_status can only be specified for female sex at birth"));
    }

    @Test
    @DisplayName("POST /signals rejects readings without a value instead of reading them as zero")
    void missingValue() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"readings": [{"canonical_name": "Platelet Count", "unit": "10^3/mcL"},
                                      {"canonical_name": "Hemoglobin", "value": null}]}
                        """)
                .when().post("/signals")
                .then()
                .statusCode(400)
                .body("error", equalTo("Invalid request"))
                .body("violations", contains(
                        "readings[0]: value is required",
                        "readings[1]: value is required"));
    }

    @Test
    @DisplayName("POST /signals rejects a profile without an age")
    void missingAge() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"readings": [{"canonical_name": "Hemoglobin", "value": 11.0, "unit": "g/dL"}],
                         "patient": {"sex_at_birth": "female", "pregnancy_status": "pregnant",
                                     "symptoms": ["fatigue"]}}
                        """)
                .when().post("/signals")
                .then()
                .statusCode(400)
                .body("violations", contains("patient: age is required"));
    }

    @Test
    @DisplayName("POST /signals rejects a fractional age")
    void fractionalAge() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"readings": [{"canonical_name": "Hemoglobin", "value": 11.0, "unit": "g/dL"}],
                         "patient": {"age": 28.9, "sex_at_birth": "female", "symptoms": ["fatigue"]}}
                        """)
                .when().post("/signals")
                .then()
                .statusCode(400)
                .body("error", equalTo("Invalid request"))
                .body("violations", hasSize(1))
                .body("violations[0]", startsWith("patient.age"));
    }

    @Test
    @DisplayName("POST /signals rejects symptom codes outside the vocabulary")
    void unknownSymptom() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"readings": [{"canonical_name": "Hemoglobin", "value": 11.0, "unit": "g/dL"}],
                         "patient": {"age": 30, "sex_at_birth": "female", "symptoms": ["fatigue", "headache"]}}
                        """)
                .when().post("/signals")
                .then()
                .statusCode(400)
                .body("error", equalTo("Invalid request"))
                .body("violations", hasItem(containsString("Unknown symptom: headache")));
    }

    @Test
    @DisplayName("POST /signals/matches includes the matched rules")
    void matches() {
        given()
                .contentType(ContentType.JSON)
                .body(ANEMIA_READINGS)
                .when().post("/signals/matches")
                .then()
                .statusCode(200)
                .body("matches.rule_id", contains("R001"))
                .body("signals.findings.id", contains("F001"));
    }

    @Test
    @DisplayName("POST /signals/batch answers each request in order")
    void batch() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        [{"readings": [{"canonical_name": "Platelet Count", "value": 30, "unit": "10^3/mcL"}]},
                         {"readings": [{"canonical_name": "Platelet Count", "value": 80, "unit": "10^3/mcL"}]}]
                        """)
                .when().post("/signals/batch")
                .then()
                .statusCode(200)
                .body("$", hasSize(2))
                .body("[0].signals.findings.id", contains("F003"))
                .body("[1].signals.findings", empty());
    }

    @Test
    @DisplayName("POST /signals/explain/{ruleId} explains a rule")
    void explain() {
        given()
                .contentType(ContentType.JSON)
                .body(ANEMIA_READINGS)
                .when().post("/signals/explain/R006")
                .then()
                .statusCode(200)
                .body("rule_id", equalTo("R006"))
                .body("matched", equalTo(false))
                .body("thresholds.met", contains(true, false));
    }

    @Test
    @DisplayName("POST /signals/explain/{ruleId} returns 404 for an unknown rule")
    void explainUnknownRule() {
        given()
                .contentType(ContentType.JSON)
                .body(ANEMIA_READINGS)
                .when().post("/signals/explain/R999")
                .then()
                .statusCode(404)
                .body("error", equalTo("Rule not found"));
    }
}
