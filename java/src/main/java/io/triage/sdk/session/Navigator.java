package io.triage.sdk.session;

/**
 * Hook into the host application's navigation, used to send the user back to the login entry point.
 */
public interface Navigator {

    /**
     * @return the path the application currently displays, e.g. {@code /incidents/42}.
     */
    String currentLocation();

    void navigate(String path);
}
