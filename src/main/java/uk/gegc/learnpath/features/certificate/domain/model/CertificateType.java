package uk.gegc.learnpath.features.certificate.domain.model;

public enum CertificateType {
    COMPLETION,
    ACHIEVEMENT
}
