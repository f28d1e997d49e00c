package org.stlint.analyzer.prepwork.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stlint.analyzer.common.ResolutionException;
import org.stlint.analyzer.common.model.*;
import org.stlint.analyzer.common.settings.Settings;
import org.stlint.analyzer.common.types.TypeSystem;

import java.util.*;

/*
Name and type resolution against the whole program and the current scope.

The variable stack holds the merged global variable lists at the bottom, and the declarations of
the active routine (method, property accessor or function) on top. The fields of the active
function block are not on the stack; they are computed over the full inheritance chain.

Scopes are entered through enterFunctionBlock and enterRoutine, which return a guard that must be
closed; use try-with-resources. Nesting is strict: at most one function block and one routine.
 */
public class ScopeContext {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScopeContext.class);

    private static final List<String> THIS = List.of("THIS", "THIS^");
    private static final List<String> SUPER = List.of("SUPER", "SUPER^");
    private static final Set<String> BOOLEAN_OPERATORS = Set.of("OR", "XOR", "AND", "&", "AND_THEN", "OR_ELSE",
            "=", "<>", "<=", ">=", "<", ">");
    private static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/");

    private final Program program;
    private final Settings settings;
    private final Deque<Map<String, Declaration>> varStack = new ArrayDeque<>();

    private FunctionBlock currentFunctionBlock;
    private Routine currentRoutine;

    public interface Guard extends AutoCloseable {
        @Override
        void close();
    }

    public ScopeContext(Program program, Settings settings) {
        this.program = program;
        this.settings = settings;
        Map<String, Declaration> globals = new LinkedHashMap<>();
        program.globals().values().forEach(gvl -> globals.putAll(gvl.declarations()));
        varStack.push(Collections.unmodifiableMap(globals));
    }

    public Program program() {
        return program;
    }

    public Settings settings() {
        return settings;
    }

    public FunctionBlock currentFunctionBlock() {
        return currentFunctionBlock;
    }

    public Routine currentRoutine() {
        return currentRoutine;
    }

    public int depth() {
        return varStack.size();
    }

    public Guard enterFunctionBlock(FunctionBlock functionBlock) {
        if (currentFunctionBlock != null) {
            throw new IllegalStateException("Cannot enter " + functionBlock.name() + ", already in "
                                            + currentFunctionBlock.name());
        }
        currentFunctionBlock = Objects.requireNonNull(functionBlock);
        LOGGER.debug("Enter function block {}", functionBlock.name());
        return () -> {
            LOGGER.debug("Exit function block {}", functionBlock.name());
            currentFunctionBlock = null;
        };
    }

    /*
    a function block body is not a routine scope of its own: its declarations are the fields of
    the function block
     */
    public Guard enterRoutine(Routine routine) {
        if (routine instanceof FunctionBlock) {
            throw new IllegalArgumentException("Use enterFunctionBlock for " + routine.name());
        }
        if (currentRoutine != null) {
            throw new IllegalStateException("Cannot enter " + routine.name() + ", already in "
                                            + currentRoutine.name());
        }
        currentRoutine = Objects.requireNonNull(routine);
        varStack.push(routine.declarations());
        LOGGER.debug("Enter routine {}", currentLocation());
        return () -> {
            LOGGER.debug("Exit routine {}", currentLocation());
            varStack.pop();
            currentRoutine = null;
        };
    }

    public String currentLocation() {
        if (currentFunctionBlock == null) {
            return currentRoutine == null ? "<global>" : currentRoutine.name();
        }
        String location = currentFunctionBlock.name();
        return currentRoutine == null ? location : location + "." + currentRoutine.name();
    }

    /*
    Resolution order: THIS, SUPER, builtin symbols, complex entities (types, functions, global
    variable lists), the name of the active routine, the members of the active function block
    including inherited ones, then the declaration layers from the innermost outwards.
     */
    public Resolution resolve(String name, boolean strict) {
        if (name == null) return Resolution.UNRESOLVED;
        for (String special : THIS) {
            if (Names.equal(name, special, strict)) {
                if (currentFunctionBlock == null) {
                    throw new ResolutionException(null, name + " used outside of a function block");
                }
                return Resolution.of(special, currentFunctionBlock.name());
            }
        }
        for (String special : SUPER) {
            if (Names.equal(name, special, strict)) {
                return resolveSuper(special);
            }
        }

        Names.Found<String> builtin = Names.find(settings.builtinSymbols(), name, strict);
        if (builtin != null) {
            String type = builtin.value();
            if (type.startsWith("<") && type.endsWith(">")) return Resolution.ofComplex(builtin.key());
            return Resolution.of(builtin.key(), type);
        }

        String complex = findComplex(name, strict);
        if (complex != null) return Resolution.ofComplex(complex);

        if (currentRoutine != null && Names.equal(currentRoutine.name(), name, strict)) {
            if (currentRoutine.returnType() == null) {
                throw new ResolutionException(currentRoutine, currentRoutine.name() + " has no return type");
            }
            return Resolution.of(currentRoutine.name(), currentRoutine.returnType());
        }

        if (currentFunctionBlock != null) {
            Resolution member = resolveMember(currentFunctionBlock, name, strict);
            if (member != null) return member;
        }

        for (Map<String, Declaration> layer : varStack) {
            Names.Found<Declaration> found = Names.find(layer, name, strict);
            if (found != null) return Resolution.of(found.key(), found.value().type());
        }
        return Resolution.UNRESOLVED;
    }

    public Resolution resolve(String name) {
        return resolve(name, false);
    }

    public String getVarType(String name, boolean strict) {
        return resolve(name, strict).type();
    }

    public String getVarType(String name) {
        return resolve(name, false).type();
    }

    // the declared spelling of a name that is referenced with different capitalization
    public String suggestion(String name) {
        return resolve(name, false).name();
    }

    private Resolution resolveSuper(String special) {
        if (currentFunctionBlock == null) {
            throw new ResolutionException(null, special + " used outside of a function block");
        }
        String base = currentFunctionBlock.extendsName();
        if (base == null) {
            LOGGER.warn("SUPER used in {}, which does not extend another function block", currentLocation());
            return Resolution.failed(special, currentFunctionBlock.name() + " has no base function block");
        }
        if (currentRoutine == null) {
            return Resolution.of(special, base);
        }
        String member = currentRoutine.name();
        FunctionBlock baseFb = program.functionBlock(base);
        if (baseFb != null) {
            for (FunctionBlock ancestor : allExtends(baseFb, true)) {
                if (ancestor.declaresMethodOrProperty(member)) {
                    return Resolution.of(special, ancestor.name());
                }
            }
        }
        LOGGER.warn("Failed to find type of SUPER in {}", currentLocation());
        return Resolution.failed(special, "no ancestor of " + currentFunctionBlock.name() + " declares " + member);
    }

    private String findComplex(String name, boolean strict) {
        Names.Found<?> found = Names.find(program.dataTypes(), name, strict);
        if (found == null) found = Names.find(program.functionBlocks(), name, strict);
        if (found == null) found = Names.find(TypeSystem.BUILTIN_TYPE_CONVERSIONS, name, strict);
        if (found == null) found = Names.find(TypeSystem.BUILTIN_FUNCTIONS, name, strict);
        if (found == null) found = Names.find(program.functions(), name, strict);
        if (found == null) found = Names.find(program.globals(), name, strict);
        return found == null ? null : found.key();
    }

    // fields, then properties, then methods (complex), over the inheritance chain
    private Resolution resolveMember(FunctionBlock functionBlock, String name, boolean strict) {
        Names.Found<Declaration> field = Names.find(flattenedDeclarations(functionBlock), name, strict);
        if (field != null) return Resolution.of(field.key(), field.value().type());
        for (FunctionBlock fb : allExtends(functionBlock, true)) {
            for (Property property : fb.properties()) {
                if (Names.equal(property.name(), name, strict)) return Resolution.of(property.name(), property.type());
            }
        }
        for (FunctionBlock fb : allExtends(functionBlock, true)) {
            for (Method method : fb.methods()) {
                if (Names.equal(method.name(), name, strict)) return Resolution.ofComplex(method.name());
            }
        }
        return null;
    }

    /*
    the function block itself (when withSelf), then its base, the base of its base, ...
    a missing base is logged and ends the chain; so does a cycle
     */
    public List<FunctionBlock> allExtends(FunctionBlock functionBlock, boolean withSelf) {
        List<FunctionBlock> result = new ArrayList<>();
        Set<FunctionBlock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(functionBlock);
        if (withSelf) result.add(functionBlock);
        FunctionBlock fb = functionBlock;
        while (fb.extendsName() != null) {
            FunctionBlock base = program.functionBlock(fb.extendsName());
            if (base == null) {
                LOGGER.warn("Failed to get function block extension '{}' for {}", fb.extendsName(), fb.name());
                break;
            }
            if (!seen.add(base)) {
                LOGGER.warn("Cyclic extension of {} through {}", functionBlock.name(), base.name());
                break;
            }
            result.add(base);
            fb = base;
        }
        return result;
    }

    // the derived declaration wins over the inherited one with the same name
    public Map<String, Declaration> flattenedDeclarations(FunctionBlock functionBlock) {
        Map<String, Declaration> map = new LinkedHashMap<>();
        for (FunctionBlock fb : allExtends(functionBlock, true)) {
            fb.declarations().forEach((name, d) -> {
                if (Names.find(map, name, false) == null) map.put(name, d);
            });
        }
        return map;
    }

    public Map<String, Declaration> flattenedFields(DataType dataType) {
        Map<String, Declaration> map = new LinkedHashMap<>();
        Set<DataType> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        DataType dt = dataType;
        while (dt != null && seen.add(dt)) {
            dt.declarations().forEach((name, d) -> {
                if (Names.find(map, name, false) == null) map.put(name, d);
            });
            dt = dt.extendsName() == null ? null : program.dataType(dt.extendsName());
        }
        return map;
    }

    // the method as seen from the type, own or inherited; null when there is none
    public Method findMethod(String typeName, String methodName) {
        FunctionBlock fb = program.functionBlock(typeName);
        if (fb == null) return null;
        for (FunctionBlock ancestor : allExtends(fb, true)) {
            Method method = ancestor.method(methodName);
            if (method != null) return method;
        }
        return null;
    }

    /*
    Type of a field or property of a function block or structure. References are looked through,
    aliases are followed, enumeration values have the type of their enumeration.
     */
    public String getFieldType(String baseType, String field) {
        if (baseType == null) return null;
        String type = baseType.trim();
        if (TypeSystem.isReference(type)) type = TypeSystem.referenceBaseType(type);
        FunctionBlock fb = program.functionBlock(type);
        if (fb != null) {
            Declaration d = Names.get(flattenedDeclarations(fb), field);
            if (d != null) return d.type();
            for (FunctionBlock ancestor : allExtends(fb, true)) {
                Property property = ancestor.property(field);
                if (property != null) return property.type();
            }
            return null;
        }
        DataType dataType = program.dataType(type);
        Set<DataType> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        while (dataType != null && dataType.kind() == DataType.Kind.ALIAS && seen.add(dataType)) {
            type = dataType.aliasType();
            dataType = program.dataType(type);
        }
        if (dataType == null) {
            return seen.isEmpty() ? null : getFieldType(type, field);
        }
        if (dataType.isEnum()) {
            return Names.contains(dataType.enumValues(), field) ? dataType.name() : null;
        }
        Declaration d = Names.get(flattenedFields(dataType), field);
        return d == null ? null : d.type();
    }

    /*
    Walks the accessors left to right: a subscript list consumes all dimensions of an array type,
    a field selector selects a field of the current type. Partial access of a multi-dimensional
    array is not supported.
     */
    public Resolution resolveMultiElement(String name, List<Accessor> elements) {
        Resolution start = resolve(name, false);
        String type;
        int i = 0;
        if (start.complex()) {
            GlobalVariableList gvl = Names.get(program.globals(), name);
            DataType dataType = program.dataType(name);
            if (gvl != null && !elements.isEmpty() && elements.get(0) instanceof Accessor.FieldSelector fs) {
                Declaration d = Names.get(gvl.declarations(), fs.field());
                type = d == null ? null : d.type();
                i = 1;
            } else if (dataType != null && dataType.isEnum() && elements.size() == 1
                       && elements.get(0) instanceof Accessor.FieldSelector fs) {
                return Names.contains(dataType.enumValues(), fs.field()) ? Resolution.of(start.name(), dataType.name())
                        : Resolution.failed(start.name(), fs.field() + " is not a value of " + dataType.name());
            } else {
                return start;
            }
        } else {
            type = start.type();
        }
        for (; i < elements.size(); i++) {
            if (type == null) return Resolution.failed(start.name(), start.diagnostic());
            Accessor accessor = elements.get(i);
            if (accessor instanceof Accessor.SubscriptList sl) {
                TypeSystem.ArrayType arrayType = TypeSystem.arrayType(type);
                if (arrayType == null) {
                    return Resolution.failed(start.name(), "subscript on " + type + ", which is not an array");
                }
                if (arrayType.dimensions() != sl.subscripts().size()) {
                    LOGGER.warn("Unsupported: partial multi-dimensional array access in {}", currentLocation());
                    return Resolution.failed(start.name(), "partial multi-dimensional array access: "
                                                           + sl.subscripts().size() + " of "
                                                           + arrayType.dimensions() + " dimensions");
                }
                type = arrayType.elementType();
            } else if (accessor instanceof Accessor.FieldSelector fs) {
                String base = fs.dereferenced() && TypeSystem.isPointer(type) ? TypeSystem.pointerBaseType(type) : type;
                type = getFieldType(base, fs.field());
            }
        }
        return type == null ? Resolution.failed(start.name(), null) : Resolution.of(start.name(), type);
    }

    public String getMultiElementType(String name, List<Accessor> elements) {
        return resolveMultiElement(name, elements).type();
    }

    /*
    Type of an expression, by structure. Throws a ResolutionException on operators that have no
    known result type; returns null, with a warning, on shapes it cannot type.
     */
    public String getExprType(Expression expression) {
        if (expression instanceof Literal literal) {
            if (literal.typeName() != null) return literal.typeName();
            if (literal.kind().defaultType() != null) return literal.kind().defaultType();
        } else if (expression instanceof SimpleVariable sv) {
            return getVarType(sv.name());
        } else if (expression instanceof MultiElementVariable mev) {
            return getMultiElementType(mev.name(), mev.elements());
        } else if (expression instanceof UnaryOperation uo) {
            String op = uo.op().toUpperCase(Locale.ROOT);
            return switch (op) {
                case "NOT" -> TypeSystem.BOOL;
                case "-", "+" -> getExprType(uo.expression());
                default -> throw new ResolutionException(uo, "Unsupported unary operator " + uo.op());
            };
        } else if (expression instanceof BinaryOperation bo) {
            String op = bo.op().toUpperCase(Locale.ROOT);
            if (BOOLEAN_OPERATORS.contains(op)) return TypeSystem.BOOL;
            if ("MOD".equals(op)) return getExprType(bo.left());
            if (ARITHMETIC_OPERATORS.contains(op)) {
                return TypeSystem.commonArithmeticType(getExprType(bo.left()), getExprType(bo.right()));
            }
            throw new ResolutionException(bo, "Unsupported binary operator " + bo.op());
        } else if (expression instanceof ParenthesizedExpression pe) {
            return getExprType(pe.expression());
        } else if (expression instanceof CallExpression call) {
            String type = getCallType(call);
            if (type != null) return type;
        }
        LOGGER.warn("Unsupported or unknown expression type accessor: {} in {}", expression.text(), currentLocation());
        return null;
    }

    private String getCallType(CallExpression call) {
        String name = call.simpleName();
        if (name != null) {
            String conversion = TypeSystem.conversionTarget(name);
            if (conversion != null) return conversion;
            String builtin = TypeSystem.builtinFunctionReturnType(name);
            if (builtin != null) return builtin;
            Function function = program.function(name);
            if (function != null) return function.returnType();
            // calling the body of a function block instance
            String instanceType = getVarType(name);
            if (instanceType == null && currentFunctionBlock != null) {
                Method method = findMethod(currentFunctionBlock.name(), name);
                if (method != null) return method.returnType();
            }
            return instanceType;
        }
        if (call.name() instanceof MultiElementVariable mev && !mev.elements().isEmpty()
            && mev.elements().get(mev.elements().size() - 1) instanceof Accessor.FieldSelector fs) {
            List<Accessor> prefix = mev.elements().subList(0, mev.elements().size() - 1);
            String owner = prefix.isEmpty() ? getVarType(mev.name()) : getMultiElementType(mev.name(), prefix);
            if (owner != null) {
                String type = owner;
                if (TypeSystem.isReference(type)) type = TypeSystem.referenceBaseType(type);
                if (fs.dereferenced() && TypeSystem.isPointer(type)) type = TypeSystem.pointerBaseType(type);
                Method method = findMethod(type, fs.field());
                if (method != null) return method.returnType();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "ScopeContext<" + currentLocation() + ", depth " + varStack.size() + ">";
    }
}
