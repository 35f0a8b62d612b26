package com.jobly.board.api;

import com.jobly.board.auth.BearerTokenFilter;
import com.jobly.board.auth.IdentityClaim;
import com.jobly.board.auth.TokenCodec;
import com.jobly.board.model.NewCompany;
import com.jobly.board.model.NewJob;
import com.jobly.board.persistence.CompanyJdbcRepository;
import com.jobly.board.persistence.JobJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.math.BigDecimal;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JobEndpointTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private BearerTokenFilter bearerTokenFilter;

    @Autowired
    private TokenCodec tokenCodec;

    @Autowired
    private CompanyJdbcRepository companies;

    @Autowired
    private JobJdbcRepository jobs;

    private MockMvc mockMvc;
    private String adminToken;
    private String userToken;
    private long softwareEngineerId;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).addFilters(bearerTokenFilter).build();
        adminToken = "Bearer " + tokenCodec.encode(new IdentityClaim("admin", true));
        userToken = "Bearer " + tokenCodec.encode(new IdentityClaim("u1", false));

        companies.insert(new NewCompany("acme", "Acme", "Anvils", 40, null));
        softwareEngineerId = jobs.insert(new NewJob("Software Engineer", 60000, new BigDecimal("0.05"), "acme")).id();
        jobs.insert(new NewJob("Senior Engineer", 40000, new BigDecimal("0.1"), "acme"));
        jobs.insert(new NewJob("Engineer Intern", 70000, BigDecimal.ZERO, "acme"));
        jobs.insert(new NewJob("Accountant", 90000, new BigDecimal("0.02"), "acme"));
    }

    @Test
    void listsAllJobsWithCompanyName() throws Exception {
        mockMvc.perform(get("/jobs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobs.length()").value(4))
            .andExpect(jsonPath("$.jobs[0].title").value("Accountant"))
            .andExpect(jsonPath("$.jobs[0].companyHandle").value("acme"))
            .andExpect(jsonPath("$.jobs[0].companyName").value("Acme"));
    }

    @Test
    void combinesSalaryEquityAndTitleFilters() throws Exception {
        mockMvc.perform(get("/jobs")
                .param("minSalary", "50000")
                .param("hasEquity", "true")
                .param("title", "Engineer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobs.length()").value(1))
            .andExpect(jsonPath("$.jobs[0].id").value(softwareEngineerId));
    }

    @Test
    void hasEquityFalseDoesNotFilter() throws Exception {
        mockMvc.perform(get("/jobs").param("hasEquity", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobs.length()").value(4));
    }

    @Test
    void titleFilterIsCaseInsensitive() throws Exception {
        mockMvc.perform(get("/jobs").param("title", "engineer"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobs.length()").value(3));
    }

    @Test
    void negativeMinSalaryIsBadRequest() throws Exception {
        mockMvc.perform(get("/jobs").param("minSalary", "-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.status").value(400));
    }

    @Test
    void getIncludesCompany() throws Exception {
        mockMvc.perform(get("/jobs/" + softwareEngineerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.job.title").value("Software Engineer"))
            .andExpect(jsonPath("$.job.salary").value(60000))
            .andExpect(jsonPath("$.job.company.handle").value("acme"))
            .andExpect(jsonPath("$.job.company.numEmployees").value(40));
    }

    @Test
    void missingOrMalformedIdIsRejected() throws Exception {
        mockMvc.perform(get("/jobs/0"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.message").value("No job: 0"));
        mockMvc.perform(get("/jobs/abc"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void createRequiresAdminAndExistingCompany() throws Exception {
        String body = "{\"title\": \"Tester\", \"salary\": 1000, \"equity\": 0.5, \"companyHandle\": \"acme\"}";
        mockMvc.perform(post("/jobs").header(HttpHeaders.AUTHORIZATION, userToken)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/jobs").header(HttpHeaders.AUTHORIZATION, adminToken)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.job.title").value("Tester"))
            .andExpect(jsonPath("$.job.companyHandle").value("acme"));

        mockMvc.perform(post("/jobs").header(HttpHeaders.AUTHORIZATION, adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"Ghost\", \"companyHandle\": \"ghost\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.message").value("No company: ghost"));
    }

    @Test
    void createRejectsEquityAboveOne() throws Exception {
        mockMvc.perform(post("/jobs").header(HttpHeaders.AUTHORIZATION, adminToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"Owner\", \"equity\": 1.5, \"companyHandle\": \"acme\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void patchUpdatesTitleButNotCompany() throws Exception {
        mockMvc.perform(patch("/jobs/" + softwareEngineerId).header(HttpHeaders.AUTHORIZATION, adminToken)
                .contentType(MediaType.APPLICATION_JSON).content("{\"title\": \"Staff Engineer\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.job.title").value("Staff Engineer"))
            .andExpect(jsonPath("$.job.salary").value(60000));

        mockMvc.perform(patch("/jobs/" + softwareEngineerId).header(HttpHeaders.AUTHORIZATION, adminToken)
                .contentType(MediaType.APPLICATION_JSON).content("{\"companyHandle\": \"other\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("Unexpected field: companyHandle"));

        mockMvc.perform(patch("/jobs/" + softwareEngineerId).header(HttpHeaders.AUTHORIZATION, adminToken)
                .contentType(MediaType.APPLICATION_JSON).content("{\"id\": 5}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void deleteRequiresAdmin() throws Exception {
        mockMvc.perform(delete("/jobs/" + softwareEngineerId))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(delete("/jobs/" + softwareEngineerId).header(HttpHeaders.AUTHORIZATION, adminToken))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(softwareEngineerId));

        mockMvc.perform(get("/jobs/" + softwareEngineerId)).andExpect(status().isNotFound());
    }
}
