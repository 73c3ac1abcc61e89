package monoc.mono;

public class MonomorphizationException extends RuntimeException {
    public MonomorphizationException(String message) {
        super(message);
    }
}
