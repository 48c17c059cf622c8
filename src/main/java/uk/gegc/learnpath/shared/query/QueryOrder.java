package uk.gegc.learnpath.shared.query;

public record QueryOrder(String attribute, boolean ascending) {
}
