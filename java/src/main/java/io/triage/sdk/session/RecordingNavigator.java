package io.triage.sdk.session;

import java.util.ArrayList;
import java.util.List;

/**
 * Headless {@link Navigator} that tracks the current location and remembers every navigation.
 */
public final class RecordingNavigator implements Navigator {

    private final List<String> history = new ArrayList<>();
    private String location;

    public RecordingNavigator() {
        this("/");
    }

    public RecordingNavigator(String initialLocation) {
        this.location = initialLocation;
    }

    @Override
    public synchronized String currentLocation() {
        return location;
    }

    @Override
    public synchronized void navigate(String path) {
        history.add(path);
        location = path;
    }

    public synchronized List<String> history() {
        return List.copyOf(history);
    }
}
