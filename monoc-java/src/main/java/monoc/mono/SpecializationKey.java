package monoc.mono;

import java.util.List;

public record SpecializationKey(
        String functionName,
        List<CompileTimeValue> args
) {
    public SpecializationKey {
        args = List.copyOf(args);
    }
}
