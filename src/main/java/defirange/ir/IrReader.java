package defirange.ir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import defirange.typing.SemanticType;

/**
 * Reads programs in a line based text form:
 * <pre>
 * # comment
 * contract Vault is ERC20, Ownable
 *   state uint256 totalSupply
 *   function withdraw            (or "function constructor" / "function init constructor")
 *     param uint256 amount
 *     returns uint256 result
 *     local uint256 fee
 *     temp uint256 tmp
 *     node 0 -> 1, 2
 *       if amount &gt; 0
 *       fee = amount / 100
 *       tmp = amount - fee
 *       result = uint128(tmp)              (conversion to the type of the target)
 *       tmp = msg.value                    (member access)
 *       tmp = call SafeMath.sub(amount, fee) : uint256
 *     node 1
 *     node 2
 * </pre>
 * Operators need to be separated by whitespace, names have to be declared before they are used.
 * Any {@code name(operand)} expression converts to the type of the target.
 * Successors may refer to nodes declared later in the same function.
 */
public class IrReader {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern NUMBER = Pattern.compile("-?(0[xX][0-9a-fA-F_]+|[0-9_]+)");
    private static final Pattern ASSIGNMENT = Pattern.compile("([A-Za-z_$][A-Za-z0-9_$]*)\\s*=\\s*(.+)");
    private static final Pattern CALL = Pattern.compile("call\\s+(?:([A-Za-z_$][A-Za-z0-9_$]*)\\.)?([A-Za-z_$][A-Za-z0-9_$]*)"
            + "\\s*\\((.*)\\)\\s*(?::\\s*(\\S+(?:\\s+payable)?))?");
    private static final Pattern CONVERSION = Pattern.compile("([A-Za-z_$][A-Za-z0-9_$]*)\\s*\\((.+)\\)");
    private static final Pattern MEMBER = Pattern.compile("([A-Za-z_$][A-Za-z0-9_$]*)\\.([A-Za-z_$][A-Za-z0-9_$]*)");
    private static final Pattern NODE = Pattern.compile("node\\s+(-?\\d+)(?:\\s*->\\s*(.*))?");

    private final Program program = new Program();
    private Contract contract;
    private Function function;
    private Node node;
    private int lineNumber;
    /**
     * Parameters, return variables and locals of the current function
     */
    private final Map<String, Variable> scope = new HashMap<>();
    private final Map<Integer, Node> nodes = new LinkedHashMap<>();
    /**
     * Successor ids per node, resolved at the end of the function
     */
    private final Map<Node, List<Integer>> successorIds = new LinkedHashMap<>();
    private final Map<Node, Integer> successorLines = new HashMap<>();

    private IrReader() {
    }

    public static Program read(Path path) throws IOException {
        return parse(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    /**
     * @throws IrParsingError if the text is not a valid program
     */
    public static Program parse(String text) {
        IrReader reader = new IrReader();
        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            reader.lineNumber = i + 1;
            String line = lines[i];
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.replace('\t', ' ').trim();
            if (!line.isEmpty()) {
                reader.line(line);
            }
        }
        reader.finishFunction();
        return reader.program;
    }

    private void line(String line) {
        String keyword = StringUtils.substringBefore(line, " ");
        String rest = StringUtils.substringAfter(line, " ").trim();
        switch (keyword) {
            case "contract":
                contract(rest);
                break;
            case "state":
                requireContract();
                contract.addStateVariable(declaration(rest, Variable.Kind.STATE));
                break;
            case "function":
                function(rest);
                break;
            case "param":
                requireFunction().addParameter(declare(rest, Variable.Kind.PARAMETER));
                break;
            case "returns":
                requireFunction().addReturn(declare(rest, Variable.Kind.RETURN));
                break;
            case "local":
                requireFunction();
                declare(rest, Variable.Kind.LOCAL);
                break;
            case "temp":
                requireFunction();
                declare(rest, Variable.Kind.TEMPORARY);
                break;
            case "node":
                node(line);
                break;
            case "if":
                condition(rest);
                break;
            default:
                instruction(line);
        }
    }

    private void contract(String rest) {
        finishFunction();
        String[] parts = rest.split("\\s+is\\s+", 2);
        String name = identifier(parts[0].trim());
        contract = new Contract(name);
        if (parts.length > 1) {
            for (String base : parts[1].split(",")) {
                contract.addBaseContract(identifier(base.trim()));
            }
        }
        program.add(contract);
    }

    private void function(String rest) {
        requireContract();
        finishFunction();
        String[] parts = rest.split("\\s+");
        String name = identifier(parts[0]);
        boolean isConstructor = name.equals("constructor") || (parts.length > 1 && parts[1].equals("constructor"));
        if (parts.length > 2 || (parts.length == 2 && !parts[1].equals("constructor"))) {
            throw error("Expected 'function <name> [constructor]'");
        }
        function = new Function(name, isConstructor);
        contract.addFunction(function);
    }

    private void finishFunction() {
        for (Map.Entry<Node, List<Integer>> entry : successorIds.entrySet()) {
            for (int id : entry.getValue()) {
                Node successor = nodes.get(id);
                if (successor == null) {
                    throw new IrParsingError(successorLines.get(entry.getKey()), String.format("Unknown successor node %d", id));
                }
                entry.getKey().addSuccessor(successor);
            }
        }
        function = null;
        node = null;
        scope.clear();
        nodes.clear();
        successorIds.clear();
        successorLines.clear();
    }

    private Variable declaration(String rest, Variable.Kind kind) {
        String[] parts = rest.split("\\s+");
        if (parts.length < 2) {
            throw error("Expected '<type> <name>'");
        }
        String typeName = String.join(" ", Arrays.copyOf(parts, parts.length - 1));
        return new Variable(identifier(parts[parts.length - 1]), SemanticType.parse(typeName), kind);
    }

    private Variable declare(String rest, Variable.Kind kind) {
        Variable variable = declaration(rest, kind);
        if (scope.containsKey(variable.name)) {
            throw error(String.format("Variable %s is declared twice", variable.name));
        }
        scope.put(variable.name, variable);
        return variable;
    }

    private void node(String line) {
        requireFunction();
        Matcher matcher = NODE.matcher(line);
        if (!matcher.matches()) {
            throw error("Expected 'node <id> [-> <id>, ...]'");
        }
        int id;
        try {
            id = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw error(String.format("Invalid node id '%s'", matcher.group(1)));
        }
        if (nodes.containsKey(id)) {
            throw error(String.format("Node %d is declared twice", id));
        }
        node = new Node(id);
        nodes.put(id, node);
        function.addNode(node);
        List<Integer> successors = new ArrayList<>();
        if (matcher.group(2) != null) {
            for (String successor : matcher.group(2).split(",")) {
                try {
                    successors.add(Integer.parseInt(successor.trim()));
                } catch (NumberFormatException e) {
                    throw error(String.format("Invalid successor '%s'", successor.trim()));
                }
            }
        }
        successorIds.put(node, successors);
        successorLines.put(node, lineNumber);
    }

    private void condition(String rest) {
        requireNode();
        String[] parts = rest.split("\\s+");
        if (parts.length != 3) {
            throw error("Expected 'if <operand> <comparison> <operand>'");
        }
        BinaryOperator operator = BinaryOperator.fromSymbol(parts[1]);
        if (!operator.isComparison()) {
            throw error(String.format("'%s' is not a comparison", parts[1]));
        }
        node.condition(new Condition(operator, operand(parts[0]), operand(parts[2])));
    }

    private void instruction(String line) {
        requireNode();
        Matcher assignment = ASSIGNMENT.matcher(line);
        if (!assignment.matches()) {
            throw error(String.format("Unknown statement '%s'", line));
        }
        Variable target = variable(assignment.group(1));
        String expression = assignment.group(2).trim();
        Matcher call = CALL.matcher(expression);
        if (call.matches()) {
            String returnType = call.group(4);
            Instruction.Callee callee = new Instruction.Callee(call.group(2), call.group(1) == null ? "" : call.group(1),
                    returnType == null ? null : SemanticType.parse(returnType));
            List<Operand> arguments = new ArrayList<>();
            if (!call.group(3).trim().isEmpty()) {
                for (String argument : call.group(3).split(",")) {
                    arguments.add(operand(argument.trim()));
                }
            }
            node.add(new Instruction.Call(target, callee, arguments));
            return;
        }
        String[] parts = expression.split("\\s+");
        if (parts.length == 3) {
            BinaryOperator operator = BinaryOperator.fromSymbol(parts[1]);
            node.add(new Instruction.BinaryOp(target, operator, operand(parts[0]), operand(parts[2])));
            return;
        }
        if (parts.length != 1) {
            throw error(String.format("Unknown expression '%s'", expression));
        }
        Matcher conversion = CONVERSION.matcher(expression);
        if (conversion.matches()) {
            node.add(new Instruction.TypeConversion(target, operand(conversion.group(2).trim())));
            return;
        }
        Matcher member = MEMBER.matcher(expression);
        if (member.matches()) {
            node.add(new Instruction.MemberAccess(target, member.group(1), member.group(2)));
            return;
        }
        node.add(new Instruction.Assignment(target, operand(expression)));
    }

    private Operand operand(String text) {
        if (NUMBER.matcher(text).matches() || (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\""))) {
            return new Constant(text);
        }
        if (text.equals("true") || text.equals("false")) {
            return Constant.of(text.equals("true") ? 1 : 0);
        }
        return variable(text);
    }

    private Variable variable(String name) {
        Variable variable = scope.get(identifier(name));
        if (variable != null) {
            return variable;
        }
        return contract.stateVariable(name).orElseThrow(() -> error(String.format("Unknown variable %s", name)));
    }

    private String identifier(String text) {
        if (!IDENTIFIER.matcher(text).matches()) {
            throw error(String.format("Invalid identifier '%s'", text));
        }
        return text;
    }

    private void requireContract() {
        if (contract == null) {
            throw error("Declaration outside of a contract");
        }
    }

    private Function requireFunction() {
        if (function == null) {
            throw error("Declaration outside of a function");
        }
        return function;
    }

    private void requireNode() {
        requireFunction();
        if (node == null) {
            throw error("Statement outside of a node");
        }
    }

    private IrParsingError error(String message) {
        return new IrParsingError(lineNumber, message);
    }
}
