package dev.ebullient.riddle;

/**
 * Typed failure of a game-state operation. Whatever raised it, the campaign
 * state is unchanged and nothing was published.
 */
public class GameStateException extends RuntimeException {

    public enum ErrorKind {
        NOT_FOUND,
        INVALID_STATE,
        VALIDATION,
        PERSISTENCE
    }

    private final ErrorKind kind;

    public GameStateException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GameStateException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static GameStateException notFound(String message) {
        return new GameStateException(ErrorKind.NOT_FOUND, message);
    }

    public static GameStateException invalidState(String message) {
        return new GameStateException(ErrorKind.INVALID_STATE, message);
    }

    public static GameStateException validation(String message) {
        return new GameStateException(ErrorKind.VALIDATION, message);
    }

    public static GameStateException persistence(String message, Throwable cause) {
        return new GameStateException(ErrorKind.PERSISTENCE, message, cause);
    }
}
