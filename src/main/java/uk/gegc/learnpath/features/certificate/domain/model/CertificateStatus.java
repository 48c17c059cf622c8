package uk.gegc.learnpath.features.certificate.domain.model;

public enum CertificateStatus {
    ISSUED,
    REVOKED
}
