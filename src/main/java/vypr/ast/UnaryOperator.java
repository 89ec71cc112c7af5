package vypr.ast;

public enum UnaryOperator {
    PLUS("+"),
    MINUS("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static UnaryOperator fromSymbol(String symbol) {
        return "-".equals(symbol) ? MINUS : PLUS;
    }
}
