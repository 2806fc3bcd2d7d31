package tbasic.ir;

import java.util.List;

public record FunctionType(IrType returnType, List<IrType> paramTypes, boolean varArgs) {
    public FunctionType {
        paramTypes = List.copyOf(paramTypes);
    }

    public boolean accepts(int argc) {
        return varArgs ? argc >= paramTypes.size() : argc == paramTypes.size();
    }
}
