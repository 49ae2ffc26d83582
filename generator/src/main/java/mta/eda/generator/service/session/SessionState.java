package mta.eda.generator.service.session;

public enum SessionState {
    NEW,
    RUNNING,
    STOPPED
}
