package vypr.ir;

import vypr.CompilerOptions;
import vypr.ast.ArrayLiteral;
import vypr.ast.Assignment;
import vypr.ast.BinaryOperation;
import vypr.ast.Expression;
import vypr.ast.ExpressionStatement;
import vypr.ast.ExpressionVisitor;
import vypr.ast.ForLoop;
import vypr.ast.FunctionCall;
import vypr.ast.FunctionDeclaration;
import vypr.ast.Identifier;
import vypr.ast.IfStatement;
import vypr.ast.InputStatement;
import vypr.ast.Literal;
import vypr.ast.PrintStatement;
import vypr.ast.Program;
import vypr.ast.PropertyAccess;
import vypr.ast.ReturnStatement;
import vypr.ast.Statement;
import vypr.ast.StatementVisitor;
import vypr.ast.TimesLoop;
import vypr.ast.UnaryOperation;
import vypr.ast.VarDeclaration;
import vypr.ast.WhileLoop;
import vypr.exception.InternalCompilerError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lowers a checked program to IR. Top-level statements become the entry function, which is
 * added after every declared function.
 */
public class IRBuilder implements StatementVisitor<Void>, ExpressionVisitor<Operand> {
    private final String entryFunction;
    private final NameAllocator names;
    private final Map<String, FunctionIR> functions = new LinkedHashMap<>();

    private int tempCounter = 0;
    private int labelCounter = 0;

    private FunctionIR current;
    private List<Instruction> sink;
    // Source name to target name, innermost scope first. The last entry is the module scope.
    private final Deque<Map<String, String>> bindings = new ArrayDeque<>();
    private final Set<String> moduleNames = new HashSet<>();
    private Set<String> localNames = new HashSet<>();

    public IRBuilder() {
        this(CompilerOptions.DEFAULT);
    }

    public IRBuilder(CompilerOptions options) {
        this.entryFunction = options.entryFunction();
        this.names = new NameAllocator(entryFunction);
    }

    public Map<String, FunctionIR> generate(Program program) {
        if (current != null || !functions.isEmpty()) {
            throw new IllegalStateException("IRBuilder instances are single use");
        }
        FunctionIR main = new FunctionIR(entryFunction, List.of());
        enter(main);
        bindings.push(new HashMap<>());
        for (Statement statement : program.statements()) {
            statement.accept(this);
        }
        finish(main);
        functions.put(entryFunction, main);
        return functions;
    }

    private Location.Temp newTemp() {
        return new Location.Temp(tempCounter++);
    }

    private String newLabel() {
        return "L" + (labelCounter++);
    }

    private void emit(Instruction instruction) {
        sink.add(instruction);
    }

    private void enter(FunctionIR function) {
        current = function;
        sink = new ArrayList<>();
    }

    private void finish(FunctionIR function) {
        if (sink.isEmpty() || !(sink.get(sink.size() - 1) instanceof Instruction.Return)) {
            sink.add(new Instruction.Return(null));
        }
        for (Instruction instruction : sink) {
            function.add(instruction);
        }
    }

    private boolean inEntryFunction() {
        return current.getName().equals(entryFunction);
    }

    private boolean atModuleScope() {
        return inEntryFunction() && bindings.size() == 1;
    }

    private String declare(String source) {
        Set<String> taken = new HashSet<>(moduleNames);
        taken.addAll(localNames);
        String target = names.allocate(source, taken);
        if (atModuleScope()) {
            moduleNames.add(target);
            current.addGlobal(target);
        } else {
            localNames.add(target);
        }
        bindings.peek().put(source, target);
        return target;
    }

    private String resolve(String source) {
        for (Map<String, String> scope : bindings) {
            String target = scope.get(source);
            if (target != null) {
                return target;
            }
        }
        throw new InternalCompilerError("Unresolved name '" + source + "' reached IR generation");
    }

    // A write target; records module globals written from a declared function.
    private Location.Var writable(String source) {
        String target = resolve(source);
        if (!inEntryFunction() && isModuleBinding(source)) {
            current.addGlobal(target);
        }
        return new Location.Var(target);
    }

    private boolean isModuleBinding(String source) {
        for (Map<String, String> scope : bindings) {
            if (scope.containsKey(source)) {
                return scope == bindings.getLast();
            }
        }
        return false;
    }

    private void block(List<Statement> body) {
        bindings.push(new HashMap<>());
        for (Statement statement : body) {
            statement.accept(this);
        }
        bindings.pop();
    }

    private Operand lower(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Void visitVarDeclaration(VarDeclaration node) {
        Operand value = node.initializer() == null ? new Operand.Const(null) : lower(node.initializer());
        emit(new Instruction.Assign(new Location.Var(declare(node.name())), value));
        return null;
    }

    @Override
    public Void visitAssignment(Assignment node) {
        Operand value = lower(node.value());
        emit(new Instruction.Assign(writable(node.target().name()), value));
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement node) {
        Operand condition = lower(node.condition());
        String labelTrue = newLabel();
        String labelEnd = newLabel();
        if (node.hasElse()) {
            String labelFalse = newLabel();
            emit(new Instruction.ConditionalJump(condition, labelTrue, labelFalse));
            emit(new Instruction.Label(labelTrue));
            block(node.body());
            emit(new Instruction.Jump(labelEnd));
            emit(new Instruction.Label(labelFalse));
            block(node.elseBody());
        } else {
            emit(new Instruction.ConditionalJump(condition, labelTrue, null));
            emit(new Instruction.Label(labelTrue));
            block(node.body());
        }
        emit(new Instruction.Label(labelEnd));
        return null;
    }

    @Override
    public Void visitWhileLoop(WhileLoop node) {
        List<Instruction> outer = sink;
        List<Instruction> header = new ArrayList<>();
        sink = header;
        Operand condition = lower(node.condition());
        sink = outer;
        emit(new Instruction.LoopStart(LoopKind.WHILE, null, condition, header));
        block(node.body());
        emit(new Instruction.LoopEnd());
        return null;
    }

    @Override
    public Void visitTimesLoop(TimesLoop node) {
        Operand count = lower(node.count());
        emit(new Instruction.LoopStart(LoopKind.TIMES, newTemp(), count, List.of()));
        block(node.body());
        emit(new Instruction.LoopEnd());
        return null;
    }

    @Override
    public Void visitForLoop(ForLoop node) {
        Operand iterable = lower(node.iterable());
        bindings.push(new HashMap<>());
        Location.Var variable = new Location.Var(declare(node.variable()));
        emit(new Instruction.LoopStart(LoopKind.FOR, variable, iterable, List.of()));
        for (Statement statement : node.body()) {
            statement.accept(this);
        }
        bindings.pop();
        emit(new Instruction.LoopEnd());
        return null;
    }

    @Override
    public Void visitFunctionDeclaration(FunctionDeclaration node) {
        if (!atModuleScope()) {
            throw new InternalCompilerError("Function '" + node.name() + "' is not at module level");
        }
        Set<String> taken = new HashSet<>(moduleNames);
        taken.addAll(localNames);
        String target = names.allocate(node.name(), taken);
        moduleNames.add(target);
        bindings.peek().put(node.name(), target);

        FunctionIR caller = current;
        List<Instruction> callerSink = sink;
        Set<String> callerLocals = localNames;
        localNames = new HashSet<>();
        bindings.push(new HashMap<>());

        List<String> params = new ArrayList<>();
        for (String parameter : node.parameters()) {
            String name = names.allocate(parameter, localNames);
            localNames.add(name);
            bindings.peek().put(parameter, name);
            params.add(name);
        }
        FunctionIR function = new FunctionIR(target, params);
        enter(function);
        for (Statement statement : node.body()) {
            statement.accept(this);
        }
        finish(function);
        functions.put(target, function);

        bindings.pop();
        localNames = callerLocals;
        current = caller;
        sink = callerSink;
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node) {
        Operand value = node.value() == null ? null : lower(node.value());
        emit(new Instruction.Return(value));
        return null;
    }

    @Override
    public Void visitPrintStatement(PrintStatement node) {
        emit(new Instruction.Print(lower(node.expression())));
        return null;
    }

    @Override
    public Void visitInputStatement(InputStatement node) {
        emit(new Instruction.Input(writable(node.target())));
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement node) {
        if (node.expression() instanceof FunctionCall) {
            FunctionCall call = (FunctionCall) node.expression();
            emit(new Instruction.Call(resolve(call.name()), arguments(call.arguments()), null));
        } else {
            lower(node.expression());
        }
        return null;
    }

    @Override
    public Operand visitBinaryOperation(BinaryOperation node) {
        Operand left = lower(node.left());
        Operand right = lower(node.right());
        Location.Temp tmp = newTemp();
        emit(new Instruction.BinaryOp(node.operator(), tmp, left, right));
        return tmp;
    }

    @Override
    public Operand visitUnaryOperation(UnaryOperation node) {
        Operand operand = lower(node.operand());
        Location.Temp tmp = newTemp();
        emit(new Instruction.UnaryOp(node.operator(), tmp, operand));
        return tmp;
    }

    @Override
    public Operand visitLiteral(Literal node) {
        return new Operand.Const(node.value());
    }

    @Override
    public Operand visitIdentifier(Identifier node) {
        return new Location.Var(resolve(node.name()));
    }

    @Override
    public Operand visitFunctionCall(FunctionCall node) {
        List<Operand> args = arguments(node.arguments());
        Location.Temp tmp = newTemp();
        emit(new Instruction.Call(resolve(node.name()), args, tmp));
        return tmp;
    }

    @Override
    public Operand visitArrayLiteral(ArrayLiteral node) {
        List<Operand> elements = arguments(node.elements());
        Location.Temp tmp = newTemp();
        emit(new Instruction.Assign(tmp, new Operand.ListValue(elements)));
        return tmp;
    }

    @Override
    public Operand visitPropertyAccess(PropertyAccess node) {
        Operand object = lower(node.object());
        Location.Temp tmp = newTemp();
        emit(new Instruction.Assign(tmp, new Operand.FieldRef(object, node.field())));
        return tmp;
    }

    private List<Operand> arguments(List<Expression> expressions) {
        List<Operand> result = new ArrayList<>();
        for (Expression expression : expressions) {
            result.add(lower(expression));
        }
        return result;
    }
}
