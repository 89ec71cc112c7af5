package vypr.ir;

import java.util.Map;

public final class IRPrinter {
    private IRPrinter() {
    }

    public static String print(Map<String, FunctionIR> functions) {
        StringBuilder sb = new StringBuilder();
        for (FunctionIR function : functions.values()) {
            sb.append(function).append("\n\n");
        }
        return sb.toString();
    }
}
