package util.llvm;

import ir.Builder;
import ir.IRModule;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.UndefValue;
import ir.value.Value;
import ir.value.constants.ConstantInt;
import ir.value.instructions.Phi;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the subset of textual LLVM IR the loop tooling consumes.
 *
 * Works in two passes: the first creates every function and basic block so
 * branches can target blocks defined later, the second builds instructions
 * through {@link Builder}. Values used before their definition (phi operands
 * flowing around a back edge) get a placeholder that is replaced once the
 * definition is seen; anything still unresolved at the closing brace of a
 * function is an error.
 */
public class LLVMIRParser {
    private static final Logger log = LoggingManager.getLogger(LLVMIRParser.class);

    private static final String NAME = "[\\w.$-]+";

    private static final Pattern FUNCTION_DECLARE_PATTERN = Pattern
            .compile("^declare\\s+(?:\\w+\\s+)*?(\\S+)\\s+@(" + NAME + ")\\s*\\(([^)]*)\\).*$");
    // define [modifiers] <retTy> @name(<params>) [attributes] {
    private static final Pattern FUNCTION_DEFINE_PATTERN = Pattern
            .compile("^define\\s+(?:\\w+\\s+)*?(\\S+)\\s+@(" + NAME + ")\\s*\\(([^)]*)\\)[^{]*\\{$");
    private static final Pattern LABEL_PATTERN = Pattern.compile("^(" + NAME + "):$");
    private static final Pattern ASSIGN_PATTERN = Pattern.compile("^%(" + NAME + ")\\s*=\\s*(.+)$");

    private static final Pattern BINARY_OP_PATTERN = Pattern
            .compile("^(\\w+)(?:\\s+(?:nsw|nuw|exact))*\\s+(\\S+)\\s+([^,]+?)\\s*,\\s*(\\S+)$");
    private static final Pattern ICMP_PATTERN = Pattern
            .compile("^icmp\\s+(eq|ne|ugt|uge|ult|ule|sgt|sge|slt|sle)\\s+(\\S+)\\s+([^,]+?)\\s*,\\s*(\\S+)$");
    private static final Pattern PHI_PATTERN = Pattern.compile("^phi\\s+(\\S+)\\s+(.+)$");
    private static final Pattern PHI_INCOMING_PATTERN = Pattern
            .compile("\\[\\s*([^,\\]]+?)\\s*,\\s*%(" + NAME + ")\\s*]");
    private static final Pattern LOAD_PATTERN = Pattern
            .compile("^load\\s+(\\S+)\\s*,\\s*(\\S+)\\s+([^,\\s]+)(?:\\s*,\\s*align\\s+\\d+)?$");
    private static final Pattern STORE_PATTERN = Pattern
            .compile("^store\\s+(\\S+)\\s+([^,]+?)\\s*,\\s*(\\S+)\\s+([^,\\s]+)(?:\\s*,\\s*align\\s+\\d+)?$");
    private static final Pattern CALL_PATTERN = Pattern
            .compile("^call\\s+(\\S+)\\s+@(" + NAME + ")\\s*\\((.*)\\)$");
    private static final Pattern BR_PATTERN = Pattern
            .compile("^br\\s+i1\\s+([^,]+?)\\s*,\\s*label\\s+%(" + NAME + ")\\s*,\\s*label\\s+%(" + NAME + ")$");
    private static final Pattern BR_UNCONDITIONAL_PATTERN = Pattern.compile("^br\\s+label\\s+%(" + NAME + ")$");
    private static final Pattern SWITCH_PATTERN = Pattern
            .compile("^switch\\s+(\\S+)\\s+([^,]+?)\\s*,\\s*label\\s+%(" + NAME + ")\\s*\\[(.*)]$");
    private static final Pattern SWITCH_CASE_PATTERN = Pattern
            .compile("(\\S+)\\s+(-?\\d+|true|false)\\s*,\\s*label\\s+%(" + NAME + ")");
    private static final Pattern RET_PATTERN = Pattern.compile("^ret\\s+(\\S+)(?:\\s+(.+))?$");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("^-?\\d+$");

    private static final Set<String> IGNORED_PREFIXES = Set.of(
            "source_filename", "target", "attributes", "!");

    private final LoaderConfig config;
    private final List<LLVMParseException.ParseError> errors;
    private final Map<String, Value> valueMap;        // "%x" -> value, current function only
    private final Map<String, UndefValue> forwardRefs; // "%x" -> placeholder awaiting its definition

    private IRModule module;
    private Function currentFunction;
    private Builder builder;
    private int currentLineNumber;

    private record SourceLine(int number, String text) {}

    public LLVMIRParser(LoaderConfig config) {
        this.config = config;
        this.errors = new ArrayList<>();
        this.valueMap = new HashMap<>();
        this.forwardRefs = new LinkedHashMap<>();
    }

    public IRModule parse(List<String> lines, String moduleName) throws LLVMParseException {
        this.module = new IRModule(moduleName);
        this.builder = new Builder(module);

        List<SourceLine> source = normalize(lines);
        firstPass(source);
        secondPass(source);

        if (!errors.isEmpty()) {
            throw new LLVMParseException("Parse failed with errors", errors);
        }
        if (config.isDebugMode()) {
            log.debug("parsed module {}:\n{}", moduleName, module.toLLVM());
        }
        return module;
    }

    /**
     * Drops comments and blank lines, and folds a multi-line switch into one line.
     */
    private List<SourceLine> normalize(List<String> lines) {
        List<SourceLine> result = new ArrayList<>();
        StringBuilder pendingSwitch = null;
        int switchLine = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = stripComment(lines.get(i)).trim();
            if (line.isEmpty() || isIgnored(line)) {
                continue;
            }
            if (pendingSwitch != null) {
                pendingSwitch.append(' ').append(line);
                if (line.contains("]")) {
                    result.add(new SourceLine(switchLine, pendingSwitch.toString()));
                    pendingSwitch = null;
                }
                continue;
            }
            if (line.startsWith("switch") && line.contains("[") && !line.contains("]")) {
                pendingSwitch = new StringBuilder(line);
                switchLine = i + 1;
                continue;
            }
            result.add(new SourceLine(i + 1, line));
        }
        if (pendingSwitch != null) {
            result.add(new SourceLine(switchLine, pendingSwitch.toString()));
        }
        return result;
    }

    private static String stripComment(String line) {
        int idx = line.indexOf(';');
        return idx >= 0 ? line.substring(0, idx) : line;
    }

    private static boolean isIgnored(String line) {
        for (String prefix : IGNORED_PREFIXES) {
            if (line.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /* ---------- first pass: functions and blocks ---------- */

    private void firstPass(List<SourceLine> source) throws LLVMParseException {
        for (SourceLine line : source) {
            currentLineNumber = line.number();
            try {
                parseLineFirstPass(line.text());
            } catch (RuntimeException e) {
                handleError(new LLVMParseException.ParseError(currentLineNumber, line.text(), e.getMessage()));
            }
        }
        currentFunction = null;
    }

    private void parseLineFirstPass(String line) {
        Matcher declMatcher = FUNCTION_DECLARE_PATTERN.matcher(line);
        if (declMatcher.matches()) {
            FunctionType type = FunctionType.get(parseType(declMatcher.group(1)),
                    parseParams(declMatcher.group(3), null));
            module.declareFunction(declMatcher.group(2), type);
            return;
        }

        Matcher defMatcher = FUNCTION_DEFINE_PATTERN.matcher(line);
        if (defMatcher.matches()) {
            List<String> argNames = new ArrayList<>();
            FunctionType type = FunctionType.get(parseType(defMatcher.group(1)),
                    parseParams(defMatcher.group(3), argNames));
            currentFunction = module.addFunction(defMatcher.group(2), type, argNames);
            return;
        }

        if (line.equals("}")) {
            currentFunction = null;
            return;
        }

        if (currentFunction == null) {
            throw new IllegalArgumentException("unexpected line outside of a function");
        }

        Matcher labelMatcher = LABEL_PATTERN.matcher(line);
        if (labelMatcher.matches()) {
            String name = labelMatcher.group(1);
            if (currentFunction.getBlockByName(name) != null) {
                throw new IllegalArgumentException("duplicate label '" + name + "'");
            }
            BasicBlock block = currentFunction.appendBasicBlock(name);
            if (!block.getName().equals(name)) {
                throw new IllegalArgumentException("label '" + name + "' collides with another name");
            }
            return;
        }

        // an instruction before the first label opens an implicit entry block
        if (currentFunction.getBlocks().isEmpty()) {
            currentFunction.appendBasicBlock("entry");
        }
    }

    /* "i32 %n, i32* %p" -> types, and names into argNames when requested */
    private List<Type> parseParams(String params, List<String> argNames) {
        List<Type> types = new ArrayList<>();
        if (params.isBlank()) {
            return types;
        }
        for (String param : params.split(",")) {
            String[] parts = param.trim().split("\\s+");
            types.add(parseType(parts[0]));
            if (argNames != null) {
                String last = parts[parts.length - 1];
                argNames.add(last.startsWith("%") ? last.substring(1) : null);
            }
        }
        return types;
    }

    /* ---------- second pass: instructions ---------- */

    private void secondPass(List<SourceLine> source) throws LLVMParseException {
        for (SourceLine line : source) {
            currentLineNumber = line.number();
            try {
                parseLineSecondPass(line.text());
            } catch (RuntimeException e) {
                handleError(new LLVMParseException.ParseError(currentLineNumber, line.text(), e.getMessage()));
            }
        }
    }

    private void parseLineSecondPass(String line) throws LLVMParseException {
        if (FUNCTION_DECLARE_PATTERN.matcher(line).matches()) {
            return;
        }

        Matcher defMatcher = FUNCTION_DEFINE_PATTERN.matcher(line);
        if (defMatcher.matches()) {
            startFunction(module.getFunction(defMatcher.group(2)));
            return;
        }

        if (line.equals("}")) {
            resolveForwardReferences(line);
            currentFunction = null;
            return;
        }

        Matcher labelMatcher = LABEL_PATTERN.matcher(line);
        if (labelMatcher.matches()) {
            builder.positionAtEnd(currentFunction.getBlockByName(labelMatcher.group(1)));
            return;
        }

        if (builder.getCurrentBlock() == null || builder.getCurrentFunction() != currentFunction) {
            throw new IllegalArgumentException("instruction outside of a basic block");
        }

        Matcher assignMatcher = ASSIGN_PATTERN.matcher(line);
        if (assignMatcher.matches()) {
            String name = assignMatcher.group(1);
            Value value = parseValueInstruction(assignMatcher.group(2), name);
            define(name, value);
        } else {
            parseVoidInstruction(line);
        }
    }

    private void startFunction(Function function) {
        currentFunction = function;
        valueMap.clear();
        forwardRefs.clear();
        for (var arg : function.getArguments()) {
            valueMap.put(arg.getName(), arg);
        }
        if (function.getEntryBlock() != null) {
            builder.positionAtEnd(function.getEntryBlock());
        }
    }

    private Value parseValueInstruction(String body, String name) {
        String op = firstToken(body);
        switch (op) {
            case "icmp": {
                Matcher m = ICMP_PATTERN.matcher(body);
                require(m.matches(), "malformed icmp");
                Type type = parseType(m.group(2));
                Opcode pred = Opcode.valueOf("ICMP_" + m.group(1).toUpperCase());
                return builder.buildICmp(pred, parseValue(m.group(3), type), parseValue(m.group(4), type), name);
            }
            case "phi": {
                Matcher m = PHI_PATTERN.matcher(body);
                require(m.matches(), "malformed phi");
                Type type = parseType(m.group(1));
                Phi phi = builder.buildPhi(type, name);
                Matcher incoming = PHI_INCOMING_PATTERN.matcher(m.group(2));
                while (incoming.find()) {
                    phi.addIncoming(parseValue(incoming.group(1), type), getBlock(incoming.group(2)));
                }
                require(phi.getNumIncoming() > 0, "phi without incoming values");
                return phi;
            }
            case "load": {
                Matcher m = LOAD_PATTERN.matcher(body);
                require(m.matches(), "malformed load");
                Type ptrType = parseType(m.group(2));
                require(ptrType.isPointer(), "load from non-pointer type " + ptrType);
                Value pointer = parseValue(m.group(3), ptrType);
                require(((PointerType) ptrType).getPointeeType().equals(parseType(m.group(1))),
                        "load type does not match pointer type");
                return builder.buildLoad(pointer, name);
            }
            case "call":
                return parseCall(body, name);
            default: {
                Matcher m = BINARY_OP_PATTERN.matcher(body);
                Opcode opcode = binaryOpcode(op);
                if (opcode == null || !m.matches()) {
                    throw new IllegalArgumentException("unsupported instruction '" + op + "'");
                }
                Type type = parseType(m.group(2));
                return builder.buildBinaryOperator(opcode, parseValue(m.group(3), type),
                        parseValue(m.group(4), type), name);
            }
        }
    }

    private void parseVoidInstruction(String line) {
        String op = firstToken(line);
        switch (op) {
            case "br": {
                Matcher cond = BR_PATTERN.matcher(line);
                if (cond.matches()) {
                    builder.buildCondBr(parseValue(cond.group(1), IntegerType.getI1()),
                            getBlock(cond.group(2)), getBlock(cond.group(3)));
                    return;
                }
                Matcher uncond = BR_UNCONDITIONAL_PATTERN.matcher(line);
                require(uncond.matches(), "malformed br");
                builder.buildBr(getBlock(uncond.group(1)));
                return;
            }
            case "switch": {
                Matcher m = SWITCH_PATTERN.matcher(line);
                require(m.matches(), "malformed switch");
                Type type = parseType(m.group(1));
                Value cond = parseValue(m.group(2), type);
                List<Builder.SwitchCase> cases = new ArrayList<>();
                Matcher caseMatcher = SWITCH_CASE_PATTERN.matcher(m.group(4));
                while (caseMatcher.find()) {
                    Type caseType = parseType(caseMatcher.group(1));
                    require(caseType.equals(type), "switch case type differs from condition type");
                    Value caseValue = parseValue(caseMatcher.group(2), caseType);
                    cases.add(new Builder.SwitchCase((ConstantInt) caseValue, getBlock(caseMatcher.group(3))));
                }
                builder.buildSwitch(cond, getBlock(m.group(3)), cases);
                return;
            }
            case "ret": {
                Matcher m = RET_PATTERN.matcher(line);
                require(m.matches(), "malformed ret");
                Type type = parseType(m.group(1));
                if (type.isVoid()) {
                    builder.buildRetVoid();
                } else {
                    require(m.group(2) != null, "ret without a value");
                    builder.buildRet(parseValue(m.group(2), type));
                }
                return;
            }
            case "store": {
                Matcher m = STORE_PATTERN.matcher(line);
                require(m.matches(), "malformed store");
                Type valueType = parseType(m.group(1));
                Value value = parseValue(m.group(2), valueType);
                Value pointer = parseValue(m.group(4), parseType(m.group(3)));
                builder.buildStore(value, pointer);
                return;
            }
            case "call":
                parseCall(line, "");
                return;
            default:
                throw new IllegalArgumentException("unsupported instruction '" + op + "'");
        }
    }

    private Value parseCall(String body, String name) {
        Matcher m = CALL_PATTERN.matcher(body);
        require(m.matches(), "malformed call");
        Function callee = module.getFunction(m.group(2));
        require(callee != null, "call to undeclared function @" + m.group(2));
        require(callee.getFunctionType().getReturnType().equals(parseType(m.group(1))),
                "call return type does not match @" + callee.getName());

        List<Type> paramTypes = callee.getFunctionType().getParamTypes();
        List<Value> args = new ArrayList<>();
        String rawArgs = m.group(3).trim();
        if (!rawArgs.isEmpty()) {
            for (String arg : rawArgs.split(",")) {
                String[] parts = arg.trim().split("\\s+");
                require(parts.length >= 2, "malformed call argument '" + arg.trim() + "'");
                args.add(parseValue(parts[parts.length - 1], parseType(parts[0])));
            }
        }
        require(args.size() == paramTypes.size(), "wrong number of arguments to @" + callee.getName());
        return builder.buildCall(callee, args, name);
    }

    /* ---------- values, types and blocks ---------- */

    private Type parseType(String text) {
        String t = text.trim();
        int stars = 0;
        while (t.endsWith("*")) {
            stars++;
            t = t.substring(0, t.length() - 1);
        }
        Type base;
        if (t.equals("void")) {
            base = VoidType.getVoid();
        } else if (t.matches("i\\d+")) {
            base = IntegerType.getInteger(Integer.parseInt(t.substring(1)));
        } else {
            throw new IllegalArgumentException("unsupported type '" + text.trim() + "'");
        }
        for (int i = 0; i < stars; i++) {
            base = PointerType.get(base);
        }
        return base;
    }

    private Value parseValue(String text, Type type) {
        String token = text.trim();
        if (token.startsWith("%")) {
            String name = token.substring(1);
            Value value = valueMap.get(name);
            if (value != null) {
                return value;
            }
            if (!config.isAllowForwardReferences()) {
                throw new IllegalArgumentException("use of undefined value " + token);
            }
            return forwardRefs.computeIfAbsent(name, n -> UndefValue.createPlaceholder(type, n));
        }
        if (token.startsWith("@")) {
            Function function = module.getFunction(token.substring(1));
            require(function != null, "unknown global " + token);
            return function;
        }
        if (token.equals("true") || token.equals("false")) {
            require(type.isI1(), token + " used as " + type);
            return ConstantInt.getBool(token.equals("true"));
        }
        if (token.equals("undef")) {
            return UndefValue.get(type);
        }
        if (INTEGER_PATTERN.matcher(token).matches()) {
            require(type instanceof IntegerType, "integer literal used as " + type);
            return new ConstantInt((IntegerType) type, Long.parseLong(token));
        }
        throw new IllegalArgumentException("cannot parse value '" + token + "'");
    }

    private BasicBlock getBlock(String name) {
        BasicBlock block = currentFunction.getBlockByName(name);
        require(block != null, "unknown label %" + name);
        return block;
    }

    private void define(String name, Value value) {
        require(!valueMap.containsKey(name), "redefinition of %" + name);
        UndefValue placeholder = forwardRefs.remove(name);
        if (placeholder != null) {
            require(placeholder.getType().equals(value.getType()),
                    "%" + name + " defined as " + value.getType() + " but used as " + placeholder.getType());
            placeholder.replaceAllUsesWith(value);
        }
        valueMap.put(name, value);
    }

    // every placeholder left at the end of a function is a use without a definition
    private void resolveForwardReferences(String line) throws LLVMParseException {
        for (String name : forwardRefs.keySet()) {
            handleError(new LLVMParseException.ParseError(currentLineNumber, line,
                    "use of undefined value %" + name + " in @" + currentFunction.getName()));
        }
        forwardRefs.clear();
    }

    private static Opcode binaryOpcode(String mnemonic) {
        for (Opcode opcode : Opcode.values()) {
            if (opcode.isBinary() && opcode.getMnemonic().equals(mnemonic)) {
                return opcode;
            }
        }
        return null;
    }

    private static String firstToken(String body) {
        int idx = body.indexOf(' ');
        return idx < 0 ? body : body.substring(0, idx);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private void handleError(LLVMParseException.ParseError error) throws LLVMParseException {
        errors.add(error);
        if (config.isDebugMode()) {
            log.warn("Parse error: {}", error);
        }
        if (config.getErrorHandling() == LoaderConfig.ErrorHandling.STRICT) {
            throw new LLVMParseException("Parse error", List.of(error));
        }
        if (errors.size() >= config.getMaxErrors()) {
            throw new LLVMParseException("Too many parse errors", errors);
        }
    }
}
