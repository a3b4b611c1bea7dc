package uncharted.events;

@FunctionalInterface
public interface EventListener {

    void onEvent(EngineEvent event);
}
