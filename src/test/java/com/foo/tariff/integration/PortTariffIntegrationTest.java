package com.foo.tariff.integration;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.foo.tariff.PortTariffApplication;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.RequestBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

@SpringBootTest(classes = PortTariffApplication.class)
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PortTariffIntegrationTest {

    @Autowired private MockMvc mockMvc;

    @Test
    void bootstrapSchedule_publishedAsFirstVersion() throws Exception {
        mockMvc
                .perform(get("/api/tariff/schedules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].version").value(1))
                .andExpect(jsonPath("$[0].label").value("TNPA 2024/25 sample (DUR, CPT)"))
                .andExpect(jsonPath("$[0].ports[0]").value("DUR"))
                .andExpect(jsonPath("$[0].ports[1]").value("CPT"));
    }

    @Test
    void calculate_lightDues_forSampleVessel() throws Exception {
        mockMvc
                .perform(calculate(request("{}", "[\"light_dues\"]", true)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.schedule_version").value(1))
                .andExpect(jsonPath("$.vessel_name").value("SUDESTADA"))
                .andExpect(jsonPath("$.line_items.length()").value(1))
                .andExpect(jsonPath("$.line_items[0].rule_id").value("dur-light-dues"))
                .andExpect(jsonPath("$.line_items[0].base_amount").value(60062.04))
                .andExpect(jsonPath("$.totals.ZAR").value(60062.04))
                .andExpect(
                        jsonPath("$.explanation_refs['dur-light-dues']").value("TNPA Tariff Book 2024/25 s2.1"));
    }

    @Test
    void calculate_governmentVessel_exemptFromLightDues() throws Exception {
        mockMvc
                .perform(calculate(request("{\"government_vessel\": true}", "[\"light_dues\"]", false)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.line_items[0].exemption_applied").value("dur-light-dues-gov"))
                .andExpect(jsonPath("$.explanation_refs").isEmpty());
    }

    @Test
    void calculate_allDueTypes_followDeclaredOrder() throws Exception {
        mockMvc
                .perform(calculate(request("{\"num_operations\": 2}", "null", false)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.line_items.length()").value(7))
                .andExpect(jsonPath("$.line_items[0].due_type").value("light_dues"))
                .andExpect(jsonPath("$.line_items[1].due_type").value("vts_dues"))
                .andExpect(jsonPath("$.line_items[2].rule_id").value("dur-port-dues-basic"))
                .andExpect(jsonPath("$.line_items[3].rule_id").value("dur-port-dues-incremental"))
                .andExpect(jsonPath("$.line_items[3].base_amount").value(88938.81))
                .andExpect(jsonPath("$.line_items[4].due_type").value("pilotage_dues"))
                .andExpect(jsonPath("$.line_items[5].due_type").value("towage_dues"))
                .andExpect(jsonPath("$.line_items[5].tier_applied").value("dur-towage-t4"))
                .andExpect(jsonPath("$.line_items[6].due_type").value("running_lines_dues"))
                .andExpect(jsonPath("$.warnings").isEmpty());
    }

    @Test
    void calculate_outsideWorkingHoursDoubleHullTanker_surchargedAndReduced() throws Exception {
        String flags = "{\"num_operations\": 2, \"outside_working_hours\": true, \"double_hull_tanker\": true}";
        String dueTypes = "[\"port_dues\", \"pilotage_dues\", \"running_lines_dues\"]";

        mockMvc
                .perform(calculate(request(flags, dueTypes, false)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.line_items.length()").value(4))
                .andExpect(jsonPath("$.line_items[0].exemption_applied").value("dur-port-dues-double-hull"))
                .andExpect(jsonPath("$.line_items[1].exemption_applied").value("dur-port-dues-double-hull"))
                .andExpect(jsonPath("$.line_items[2].rule_id").value("dur-pilotage"))
                .andExpect(jsonPath("$.line_items[2].surcharges_applied[0]").value("dur-pilotage-owh"))
                .andExpect(jsonPath("$.line_items[2].base_amount").value(70784.91))
                .andExpect(jsonPath("$.line_items[3].rule_id").value("dur-running-lines"))
                .andExpect(jsonPath("$.line_items[3].surcharges_applied[0]").value("dur-running-lines-owh"))
                .andExpect(jsonPath("$.line_items[3].base_amount").value(29459.25))
                // 88983.44 + 80044.93 + 70784.91 + 29459.25
                .andExpect(jsonPath("$.totals.ZAR").value(269272.53));
    }

    @Test
    void calculate_unusuallyLargeVessel_returnsWarning() throws Exception {
        String body =
                """
                {"port": "DUR", "gross_tonnage": "700000", "due_types": ["light_dues"],
                  "arrival_date": "2024-06-10", "departure_date": "2024-06-13"}
                """;

        mockMvc
                .perform(calculate(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totals.ZAR").value(819560.0))
                .andExpect(jsonPath("$.warnings.length()").value(2))
                .andExpect(jsonPath("$.warnings[0]", containsString("700000")))
                .andExpect(jsonPath("$.warnings[1]", containsString("light_dues")));
    }

    @Test
    void calculate_grossTonnageInExponentForm_rejected() throws Exception {
        String body =
                """
                {"port": "DUR", "gross_tonnage": "1E+1000000000",
                  "arrival_date": "2024-06-10", "departure_date": "2024-06-13"}
                """;

        mockMvc
                .perform(calculate(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("gross_tonnage"));
    }

    @Test
    void calculate_pilotageWithoutOperationCount_failsOpaquely() throws Exception {
        mockMvc
                .perform(calculate(request("{}", "[\"pilotage_dues\"]", false)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("요금 계산 중 오류가 발생했습니다. 관리자에게 문의하세요."));
    }

    @Test
    void calculate_unknownPort_rejected() throws Exception {
        String body =
                """
                {"port": "ZZZ", "gross_tonnage": "51300",
                  "arrival_date": "2024-06-10", "departure_date": "2024-06-13"}
                """;

        mockMvc
                .perform(calculate(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("port"))
                .andExpect(jsonPath("$.constraint").value("known_port"));
    }

    @Test
    void calculate_unknownPinnedVersion_notFound() throws Exception {
        String body =
                """
                {"port": "DUR", "gross_tonnage": "51300", "schedule_version": 42,
                  "arrival_date": "2024-06-10", "departure_date": "2024-06-13"}
                """;

        mockMvc.perform(calculate(body)).andExpect(status().isNotFound());
    }

    @Test
    void uploadWorkbook_becomesLatestForItsPort() throws Exception {
        MockMultipartFile file =
                new MockMultipartFile(
                        "file",
                        "durban-2024-revised.xlsx",
                        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                        revisedLightDuesWorkbook());

        mockMvc
                .perform(multipart("/api/tariff/schedules/upload").file(file).param("label", "DUR revised"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.schedule.ports[0]").value("DUR"));

        mockMvc
                .perform(calculate(request("{}", "[\"light_dues\"]", false)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.schedule_version").value(2))
                .andExpect(jsonPath("$.totals.ZAR").value(61560.0));

        // CPT는 여전히 v1
        mockMvc
                .perform(
                        calculate(
                                """
                                {"port": "CPT", "gross_tonnage": "51300", "due_types": ["light_dues"],
                                  "arrival_date": "2024-06-10", "departure_date": "2024-06-13"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.schedule_version").value(1));
    }

    @Test
    void uploadWorkbook_missingRequiredColumn_rejected() throws Exception {
        byte[] bytes;
        try (XSSFWorkbook workbook = new XSSFWorkbook();
                ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet fees = workbook.createSheet("FeeRules");
            Row header = fees.createRow(0);
            header.createCell(0).setCellValue("rule_id");
            header.createCell(1).setCellValue("port");
            workbook.write(out);
            bytes = out.toByteArray();
        }
        MockMultipartFile file =
                new MockMultipartFile(
                        "file",
                        "broken.xlsx",
                        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                        bytes);

        mockMvc
                .perform(multipart("/api/tariff/schedules/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("FeeRules")));

        mockMvc.perform(get("/api/tariff/schedules")).andExpect(jsonPath("$.length()").value(1));
    }

    private static String request(String flags, String dueTypes, boolean includeExplanation) {
        return """
                {"port": "DUR", "vessel_name": "SUDESTADA", "gross_tonnage": "51300",
                  "arrival_date": "2024-06-10", "departure_date": "2024-06-13",
                  "flags": %s, "due_types": %s, "include_explanation": %s}
                """
                .formatted(flags, dueTypes, includeExplanation);
    }

    private static RequestBuilder calculate(String body) {
        return post("/api/tariff/calculate").contentType(MediaType.APPLICATION_JSON).content(body);
    }

    private static byte[] revisedLightDuesWorkbook() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
                ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet fees = workbook.createSheet("FeeRules");
            String[] headers = {"rule_id", "port", "due_type", "rate", "unit", "effective_from"};
            Row header = fees.createRow(0);
            for (int i = 0; i < headers.length; i++) {
                header.createCell(i).setCellValue(headers[i]);
            }
            Row row = fees.createRow(1);
            row.createCell(0).setCellValue("dur-light-dues-rev");
            row.createCell(1).setCellValue("DUR");
            row.createCell(2).setCellValue("light_dues");
            row.createCell(3).setCellValue(120);
            row.createCell(4).setCellValue("per_100gt");
            row.createCell(5).setCellValue("2024-04-01");
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
