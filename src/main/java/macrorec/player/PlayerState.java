package macrorec.player;

/** Lifecycle of a {@link Player}. */
public enum PlayerState {
    IDLE,
    PLAYING,
    PAUSED
}
