package org.bindforge.library;

/**
 * One parameter (or the return value) of a native function, as described by
 * the interface description.
 *
 * @param name The declared parameter name.
 * @param typ The parameter type.
 * @param cType The C spelling of the parameter type, e.g. {@code "const gchar*"}.
 * @param direction The data flow direction.
 * @param nullable Whether {@code NULL} is accepted or returned.
 * @param allowNone Whether the caller may omit the value.
 * @param transfer The declared ownership transfer.
 * @param callerAllocates Whether the caller provides the storage of an out value.
 * @param scope The lifetime of a callback value.
 * @param arrayLength Position of the parameter holding this array's length, or {@code null}.
 * @param closure Position of the user data passed to this callback, or {@code null}.
 * @param destroy Position of the destroy notification of this callback, or {@code null}.
 * @param error Whether this is the trailing error out-parameter.
 * @param instanceParameter Whether this is the receiver of a method.
 */
public record Parameter(
        String name,
        TypeId typ,
        String cType,
        ParameterDirection direction,
        boolean nullable,
        boolean allowNone,
        Transfer transfer,
        boolean callerAllocates,
        ParameterScope scope,
        Integer arrayLength,
        Integer closure,
        Integer destroy,
        boolean error,
        boolean instanceParameter
) {

    /**
     * Starts a builder with the defaults of a plain {@code IN} parameter.
     * @param name The parameter name.
     * @param typ The parameter type.
     * @return A new builder.
     */
    public static Builder builder(String name, TypeId typ) {
        return new Builder(name, typ);
    }

    /**
     * @return A builder initialized with all fields of this parameter.
     */
    public Builder toBuilder() {
        return new Builder(name, typ)
                .cType(cType)
                .direction(direction)
                .nullable(nullable)
                .allowNone(allowNone)
                .transfer(transfer)
                .callerAllocates(callerAllocates)
                .scope(scope)
                .arrayLength(arrayLength)
                .closure(closure)
                .destroy(destroy)
                .error(error)
                .instanceParameter(instanceParameter);
    }

    public static final class Builder {
        private final String name;
        private final TypeId typ;
        private String cType = "";
        private ParameterDirection direction = ParameterDirection.IN;
        private boolean nullable;
        private boolean allowNone;
        private Transfer transfer = Transfer.NONE;
        private boolean callerAllocates;
        private ParameterScope scope = ParameterScope.CALL;
        private Integer arrayLength;
        private Integer closure;
        private Integer destroy;
        private boolean error;
        private boolean instanceParameter;

        private Builder(String name, TypeId typ) {
            this.name = name;
            this.typ = typ;
        }

        public Builder cType(String cType) {
            this.cType = cType == null ? "" : cType;
            return this;
        }

        public Builder direction(ParameterDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public Builder allowNone(boolean allowNone) {
            this.allowNone = allowNone;
            return this;
        }

        public Builder transfer(Transfer transfer) {
            this.transfer = transfer;
            return this;
        }

        public Builder callerAllocates(boolean callerAllocates) {
            this.callerAllocates = callerAllocates;
            return this;
        }

        public Builder scope(ParameterScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder arrayLength(Integer arrayLength) {
            this.arrayLength = arrayLength;
            return this;
        }

        public Builder closure(Integer closure) {
            this.closure = closure;
            return this;
        }

        public Builder destroy(Integer destroy) {
            this.destroy = destroy;
            return this;
        }

        public Builder error(boolean error) {
            this.error = error;
            return this;
        }

        public Builder instanceParameter(boolean instanceParameter) {
            this.instanceParameter = instanceParameter;
            return this;
        }

        public Parameter build() {
            return new Parameter(name, typ, cType, direction, nullable, allowNone, transfer,
                    callerAllocates, scope, arrayLength, closure, destroy, error, instanceParameter);
        }
    }
}
