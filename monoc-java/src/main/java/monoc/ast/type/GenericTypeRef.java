package monoc.ast.type;

import java.util.List;

/** {@code Name<arg, ...>}: each argument is either a type or a compile-time value. */
public record GenericTypeRef(
        String name,
        List<TypeArg> args
) implements TypeRef {

    public GenericTypeRef {
        args = List.copyOf(args);
    }
}
