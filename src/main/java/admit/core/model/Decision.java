package admit.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
