package tech.yump.boundary.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.boundary.compliance.ComplianceReport;
import tech.yump.boundary.compliance.PortalType;
import tech.yump.boundary.service.ComplianceService;

import java.util.Map;

@RestController
@RequestMapping("/sys/compliance")
@RequiredArgsConstructor
@Tag(name = "System", description = "Security compliance status")
public class ComplianceController {

    private final ComplianceService complianceService;

    @GetMapping
    @Operation(summary = "Platform compliance report",
            description = "Runs the security compliance audit for this deployment's environment and returns the scored report.")
    @ApiResponse(responseCode = "200", description = "Report generated.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ComplianceReport.class)))
    public ComplianceReport getComplianceReport() {
        return complianceService.currentReport();
    }

    @GetMapping("/portals")
    @Operation(summary = "Compliance reports for every portal")
    public Map<PortalType, ComplianceReport> getPortalReports() {
        return complianceService.reportsForAllPortals();
    }

    @GetMapping("/portals/{portal}")
    @Operation(summary = "Compliance report for one portal")
    @ApiResponse(responseCode = "400", description = "Unknown portal.")
    public ComplianceReport getPortalReport(
            @Parameter(description = "Portal name: admin, customer, management, reseller or technician", example = "admin")
            @PathVariable String portal) {
        return complianceService.reportForPortal(PortalType.fromName(portal));
    }
}
