package ai.robot.tidy.transform;

/**
 * Runtime exception used to propagate a rule failure on one document.
 */
public class FormattingException extends RuntimeException {

    public FormattingException(String message, Throwable cause) {
        super(message, cause);
    }
}
