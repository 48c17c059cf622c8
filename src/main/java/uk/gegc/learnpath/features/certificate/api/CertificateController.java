package uk.gegc.learnpath.features.certificate.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnpath.features.certificate.api.dto.CertificateDto;
import uk.gegc.learnpath.features.certificate.api.dto.CertificateVerificationDto;
import uk.gegc.learnpath.features.certificate.api.dto.IssueCertificateRequest;
import uk.gegc.learnpath.features.certificate.application.CertificateService;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;

import java.util.List;
import java.util.UUID;

@Tag(name = "Certificates", description = "Issue, list, verify and revoke completion certificates")
@RestController
@RequestMapping("/api/v1/certificates")
@RequiredArgsConstructor
@Validated
public class CertificateController {

    private final CertificateService certificateService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Issue a certificate",
            description = "Issues a certificate for a completed learning path or course. Returns 204 when the user already holds one.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Certificate issued",
                    content = @Content(schema = @Schema(implementation = CertificateDto.class))),
            @ApiResponse(responseCode = "204", description = "A certificate already exists"),
            @ApiResponse(responseCode = "403", description = "Issuing for another user requires certificates:issue",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Content not completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<CertificateDto> issue(@Valid @RequestBody IssueCertificateRequest request) {
        return certificateService.issueCertificate(request.userId(), request.contentId(), request.contentKind())
                .map(dto -> ResponseEntity.status(HttpStatus.CREATED).body(dto))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Operation(summary = "List my certificates")
    @GetMapping("/me")
    public ResponseEntity<List<CertificateDto>> myCertificates() {
        UUID userId = currentUserResolver.requireCurrentUser().id();
        return ResponseEntity.ok(certificateService.getUserCertificates(userId));
    }

    @Operation(summary = "Verify a certificate", description = "Public lookup by verification code.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Certificate found"),
            @ApiResponse(responseCode = "404", description = "Unknown code",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/verify/{code}")
    public ResponseEntity<CertificateVerificationDto> verify(@PathVariable String code) {
        return ResponseEntity.ok(certificateService.verify(code));
    }

    @Operation(summary = "Revoke a certificate", description = "Idempotent; revoking a revoked certificate returns it unchanged.")
    @PostMapping("/{certificateId}/revoke")
    @PreAuthorize("hasAuthority('certificates:revoke')")
    public ResponseEntity<CertificateDto> revoke(@PathVariable UUID certificateId) {
        return ResponseEntity.ok(certificateService.revokeCertificate(certificateId));
    }
}
