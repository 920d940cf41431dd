package com.nosota.scholarship;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.ScholarshipType;
import com.nosota.scholarship.api.model.StaffRole;
import com.nosota.scholarship.api.request.CreateApplicationRequest;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.repository.ApplicationRepository;
import com.nosota.scholarship.repository.DecisionLogRepository;
import com.nosota.scholarship.repository.DisbursementRepository;
import com.nosota.scholarship.repository.FinancialTransactionRepository;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.service.ApplicationIntakeService;
import com.nosota.scholarship.service.ApplicationQueryService;
import com.nosota.scholarship.service.CalculationService;
import com.nosota.scholarship.service.DecisionLogService;
import com.nosota.scholarship.service.DepartmentReviewService;
import com.nosota.scholarship.service.DisbursementService;
import com.nosota.scholarship.service.InstituteReviewService;
import com.nosota.scholarship.service.ReviewBatchService;
import com.nosota.scholarship.service.TransferService;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class of the integration tests: full application context on a PostgreSQL container with
 * a scripted transfer gateway and a movable clock. Tests are not transactional because bulk
 * operations commit item by item; the tables are emptied after each test instead.
 */
@SpringBootTest(
        classes = ScholarshipApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@AutoConfigureMockMvc
@Testcontainers
@Import({TestGatewayConfig.class, TestAsyncConfig.class})
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    protected static final long INSTITUTE_ID = 100L;
    protected static final long OTHER_INSTITUTE_ID = 200L;
    protected static final long DEPARTMENT_ID = 10L;

    protected static final String ACCOUNT = "123456789012";
    protected static final String IFSC = "SBIN0001234";

    @Autowired
    protected ApplicationIntakeService intakeService;

    @Autowired
    protected InstituteReviewService instituteReviewService;

    @Autowired
    protected DepartmentReviewService departmentReviewService;

    @Autowired
    protected ReviewBatchService reviewBatchService;

    @Autowired
    protected DisbursementService disbursementService;

    @Autowired
    protected TransferService transferService;

    @Autowired
    protected CalculationService calculationService;

    @Autowired
    protected ApplicationQueryService queryService;

    @Autowired
    protected DecisionLogService decisionLogService;

    @Autowired
    protected ApplicationRepository applicationRepository;

    @Autowired
    protected DecisionLogRepository decisionLogRepository;

    @Autowired
    protected DisbursementRepository disbursementRepository;

    @Autowired
    protected FinancialTransactionRepository financialTransactionRepository;

    @Autowired
    protected ScriptedFundsTransferGateway gateway;

    @Autowired
    protected ConcurrentCallAsyncService asyncService;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    // Counter for generating unique student IDs in tests
    private static final AtomicLong studentCounter = new AtomicLong(1);

    @AfterEach
    void cleanUp() {
        financialTransactionRepository.deleteAll();
        disbursementRepository.deleteAll();
        decisionLogRepository.deleteAll();
        applicationRepository.deleteAll();
        gateway.reset();
        clock.reset();
    }

    protected static Actor instituteAdmin() {
        return new Actor("inst-admin", StaffRole.INSTITUTE_ADMIN, INSTITUTE_ID);
    }

    protected static Actor departmentAdmin() {
        return new Actor("dept-admin", StaffRole.DEPARTMENT_ADMIN, DEPARTMENT_ID);
    }

    protected static Actor financeAdmin() {
        return new Actor("fin-admin", StaffRole.FINANCE_ADMIN, null);
    }

    /**
     * Helper method to create a draft with bank details.
     */
    protected Application createDraft(String requestedAmount) {
        return createDraft(requestedAmount, ACCOUNT, IFSC);
    }

    protected Application createDraft(String requestedAmount, String account, String ifsc) {
        CreateApplicationRequest request = new CreateApplicationRequest(
                "STU" + studentCounter.getAndIncrement(),
                INSTITUTE_ID,
                DEPARTMENT_ID,
                ScholarshipType.MERIT,
                "Merit Scholarship",
                null,
                new BigDecimal(requestedAmount),
                "2024-25",
                Priority.MEDIUM,
                80,
                90,
                new BigDecimal("8.50"),
                CourseLevel.UNDERGRADUATE,
                account,
                ifsc
        );
        return intakeService.createApplication(request);
    }

    protected String submitted(String requestedAmount) {
        Application draft = createDraft(requestedAmount);
        return intakeService.submitApplication(draft.getApplicationId(), draft.getStudentId()).getApplicationId();
    }

    protected String instituteApproved(String requestedAmount) {
        String applicationId = submitted(requestedAmount);
        instituteReviewService.approve(applicationId, "Meets criteria", null, instituteAdmin());
        return applicationId;
    }

    protected String departmentApproved(String requestedAmount) {
        String applicationId = instituteApproved(requestedAmount);
        departmentReviewService.departmentApprove(applicationId, "Verified", null, departmentAdmin());
        return applicationId;
    }

    protected String forwarded(String requestedAmount) {
        String applicationId = departmentApproved(requestedAmount);
        reviewBatchService.forwardToFinance(
                new ForwardToFinanceRequest(List.of(applicationId), "For disbursement", Priority.HIGH),
                departmentAdmin());
        return applicationId;
    }

    /**
     * Helper method to create a forwarded application whose student has no bank account on file.
     */
    protected String forwardedWithoutBankAccount(String requestedAmount) {
        Application draft = createDraft(requestedAmount, null, IFSC);
        String applicationId = intakeService.submitApplication(draft.getApplicationId(), draft.getStudentId())
                .getApplicationId();
        instituteReviewService.approve(applicationId, "Meets criteria", null, instituteAdmin());
        departmentReviewService.departmentApprove(applicationId, "Verified", null, departmentAdmin());
        departmentReviewService.forwardToFinance(applicationId, null, null, "FWD-TEST", departmentAdmin());
        return applicationId;
    }

    protected Application reload(String applicationId) {
        return applicationRepository.findByApplicationId(applicationId).orElseThrow();
    }
}
