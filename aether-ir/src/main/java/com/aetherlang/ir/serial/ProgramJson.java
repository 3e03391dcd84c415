package com.aetherlang.ir.serial;

import com.aetherlang.ir.mir.AggregateKind;
import com.aetherlang.ir.mir.AssertMessage;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.CallingConvention;
import com.aetherlang.ir.mir.CastKind;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ConstantValue;
import com.aetherlang.ir.mir.ExternalFunction;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirLocal;
import com.aetherlang.ir.mir.MirParam;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Mutability;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Projection;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.mir.SourceInfo;
import com.aetherlang.ir.mir.SwitchTargets;
import com.aetherlang.ir.mir.TypeDefinition;
import com.aetherlang.ir.mir.UnOp;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MirProgram 与 JSON 之间的转换。
 * <p>
 * 带变体的节点写成带 "kind" 字段的对象；128 位整数写成十进制字符串；
 * 块按布局顺序写出，读回后布局顺序不变。
 */
public final class ProgramJson {

    private static final Gson GSON = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    private ProgramJson() {}

    // ==================== 入口 ====================

    public static String toJson(MirProgram program) {
        return GSON.toJson(encodeProgram(program));
    }

    public static void write(MirProgram program, Writer writer) throws IOException {
        writer.write(toJson(program));
        writer.flush();
    }

    public static void save(MirProgram program, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(program, writer);
        }
    }

    public static MirProgram fromJson(String json) {
        return decode(parse(json));
    }

    public static MirProgram read(Reader reader) {
        try {
            return decode(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new IrFormatException("JSON 语法错误", null, e);
        }
    }

    public static MirProgram load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    private static JsonElement parse(String json) {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IrFormatException("JSON 语法错误", null, e);
        }
    }

    private static MirProgram decode(JsonElement root) {
        if (root == null || !root.isJsonObject()) {
            throw new IrFormatException("顶层必须是对象", "$");
        }
        try {
            return decodeProgram(root.getAsJsonObject());
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException | NumberFormatException e) {
            throw new IrFormatException("字段类型错误", null, e);
        }
    }

    // ==================== 编码 ====================

    static JsonObject encodeProgram(MirProgram program) {
        JsonObject obj = new JsonObject();
        JsonArray functions = new JsonArray();
        for (MirFunction fn : program.getFunctions().values()) {
            functions.add(encodeFunction(fn));
        }
        obj.add("functions", functions);

        JsonObject constants = new JsonObject();
        for (Map.Entry<String, Constant> e : program.getConstants().entrySet()) {
            constants.add(e.getKey(), encodeConstant(e.getValue()));
        }
        obj.add("constants", constants);

        JsonArray externs = new JsonArray();
        for (ExternalFunction ext : program.getExternalFunctions().values()) {
            JsonObject o = new JsonObject();
            o.addProperty("name", ext.getName());
            JsonArray params = new JsonArray();
            for (MirType t : ext.getParamTypes()) params.add(encodeType(t));
            o.add("params", params);
            o.add("returnType", encodeType(ext.getReturnType()));
            o.addProperty("callingConvention", ext.getCallingConvention().name());
            o.addProperty("variadic", ext.isVariadic());
            externs.add(o);
        }
        obj.add("externalFunctions", externs);

        JsonArray types = new JsonArray();
        for (TypeDefinition def : program.getTypeDefinitions().values()) {
            JsonObject o = new JsonObject();
            o.addProperty("name", def.getName());
            JsonObject fields = new JsonObject();
            for (Map.Entry<String, MirType> f : def.getFields().entrySet()) {
                fields.add(f.getKey(), encodeType(f.getValue()));
            }
            o.add("fields", fields);
            types.add(o);
        }
        obj.add("typeDefinitions", types);
        return obj;
    }

    static JsonObject encodeFunction(MirFunction fn) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", fn.getName());
        obj.add("returnType", encodeType(fn.getReturnType()));
        JsonArray params = new JsonArray();
        for (MirParam p : fn.getParams()) {
            JsonObject o = new JsonObject();
            o.addProperty("name", p.getName());
            o.add("type", encodeType(p.getType()));
            o.addProperty("local", p.getLocal());
            params.add(o);
        }
        obj.add("params", params);
        JsonArray locals = new JsonArray();
        for (MirLocal local : fn.getLocals().values()) {
            JsonObject o = new JsonObject();
            o.addProperty("id", local.getId());
            o.addProperty("name", local.getName());
            o.add("type", encodeType(local.getType()));
            o.addProperty("mutability", local.getMutability().name());
            if (local.getSourceInfo() != null) o.add("source", encodeSource(local.getSourceInfo()));
            locals.add(o);
        }
        obj.add("locals", locals);
        obj.addProperty("entry", fn.getEntryBlock());
        obj.addProperty("returnLocal", fn.getReturnLocal());
        JsonArray blocks = new JsonArray();
        for (BasicBlock block : fn.getBlocks()) {
            JsonObject o = new JsonObject();
            o.addProperty("id", block.getId());
            if (block.getVectorWidth() != 0) o.addProperty("vectorWidth", block.getVectorWidth());
            JsonArray stmts = new JsonArray();
            for (MirStatement s : block.getStatements()) stmts.add(encodeStatement(s));
            o.add("statements", stmts);
            o.add("terminator", encodeTerminator(block.getTerminator()));
            blocks.add(o);
        }
        obj.add("blocks", blocks);
        return obj;
    }

    static JsonObject encodeType(MirType type) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", type.getKind().name());
        switch (type.getKind()) {
            case ARRAY:
                obj.add("element", encodeType(type.getElementType()));
                break;
            case REF:
                obj.add("target", encodeType(type.getElementType()));
                obj.addProperty("mutability", type.getMutability().name());
                break;
            case PTR:
                obj.add("target", encodeType(type.getElementType()));
                break;
            case NAMED:
                obj.addProperty("name", type.getName());
                break;
            default:
                break;
        }
        return obj;
    }

    static JsonObject encodeConstant(Constant constant) {
        JsonObject obj = new JsonObject();
        obj.add("type", encodeType(constant.getType()));
        ConstantValue value = constant.getValue();
        JsonObject v = new JsonObject();
        v.addProperty("kind", value.getKind().name());
        switch (value.getKind()) {
            case BOOL:
                v.addProperty("value", ((ConstantValue.Bool) value).getValue());
                break;
            case INTEGER:
                v.addProperty("value", ((ConstantValue.Int) value).getValue().toString());
                break;
            case FLOAT:
                v.addProperty("value", ((ConstantValue.Float) value).getValue());
                break;
            case STRING:
                v.addProperty("value", ((ConstantValue.Str) value).getValue());
                break;
            case CHAR:
                v.addProperty("value", ((ConstantValue.Char) value).getCodePoint());
                break;
            default:
                break;
        }
        obj.add("value", v);
        return obj;
    }

    private static JsonObject encodeSource(SourceInfo info) {
        JsonObject obj = new JsonObject();
        obj.addProperty("file", info.getFile());
        obj.addProperty("line", info.getLine());
        obj.addProperty("column", info.getColumn());
        return obj;
    }

    private static JsonObject encodePlace(Place place) {
        JsonObject obj = new JsonObject();
        obj.addProperty("local", place.getLocal());
        if (place.hasProjection()) {
            JsonArray proj = new JsonArray();
            for (Projection p : place.getProjection()) {
                JsonObject o = new JsonObject();
                o.addProperty("kind", p.getKind().name());
                switch (p.getKind()) {
                    case FIELD:
                        o.addProperty("index", ((Projection.Field) p).getIndex());
                        o.add("type", encodeType(((Projection.Field) p).getType()));
                        break;
                    case INDEX:
                        o.addProperty("local", ((Projection.Index) p).getLocal());
                        break;
                    case SUBSLICE:
                        o.addProperty("from", ((Projection.Subslice) p).getFrom());
                        o.addProperty("to", ((Projection.Subslice) p).getTo());
                        break;
                    default:
                        break;
                }
                proj.add(o);
            }
            obj.add("projection", proj);
        }
        return obj;
    }

    private static JsonObject encodeOperand(Operand op) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", op.getKind().name());
        if (op.isConstant()) {
            obj.add("constant", encodeConstant(op.getConstant()));
        } else {
            obj.add("place", encodePlace(op.getPlace()));
        }
        return obj;
    }

    private static JsonArray encodeOperands(List<Operand> ops) {
        JsonArray arr = new JsonArray();
        for (Operand op : ops) arr.add(encodeOperand(op));
        return arr;
    }

    private static JsonObject encodeRvalue(Rvalue rvalue) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", rvalue.getKind().name());
        if (rvalue instanceof Rvalue.Use) {
            obj.add("operand", encodeOperand(((Rvalue.Use) rvalue).getOperand()));
        } else if (rvalue instanceof Rvalue.BinaryOp) {
            Rvalue.BinaryOp b = (Rvalue.BinaryOp) rvalue;
            obj.addProperty("op", b.getOp().name());
            obj.add("left", encodeOperand(b.getLeft()));
            obj.add("right", encodeOperand(b.getRight()));
        } else if (rvalue instanceof Rvalue.UnaryOp) {
            Rvalue.UnaryOp u = (Rvalue.UnaryOp) rvalue;
            obj.addProperty("op", u.getOp().name());
            obj.add("operand", encodeOperand(u.getOperand()));
        } else if (rvalue instanceof Rvalue.Call) {
            Rvalue.Call c = (Rvalue.Call) rvalue;
            obj.add("func", encodeOperand(c.getFunc()));
            obj.add("args", encodeOperands(c.getArgs()));
        } else if (rvalue instanceof Rvalue.Aggregate) {
            Rvalue.Aggregate a = (Rvalue.Aggregate) rvalue;
            AggregateKind ak = a.getAggregateKind();
            JsonObject k = new JsonObject();
            k.addProperty("kind", ak.getKind().name());
            if (ak.getElementType() != null) k.add("element", encodeType(ak.getElementType()));
            if (ak.getName() != null) k.addProperty("name", ak.getName());
            if (ak.getKind() == AggregateKind.Kind.ENUM) k.addProperty("variant", ak.getVariant());
            obj.add("aggregate", k);
            obj.add("operands", encodeOperands(a.getOperands()));
        } else if (rvalue instanceof Rvalue.Cast) {
            Rvalue.Cast c = (Rvalue.Cast) rvalue;
            obj.addProperty("castKind", c.getCastKind().name());
            obj.add("operand", encodeOperand(c.getOperand()));
            obj.add("type", encodeType(c.getType()));
        } else if (rvalue instanceof Rvalue.Ref) {
            obj.add("place", encodePlace(((Rvalue.Ref) rvalue).getPlace()));
            obj.addProperty("mutability", ((Rvalue.Ref) rvalue).getMutability().name());
        } else if (rvalue instanceof Rvalue.Len) {
            obj.add("place", encodePlace(((Rvalue.Len) rvalue).getPlace()));
        } else if (rvalue instanceof Rvalue.Discriminant) {
            obj.add("place", encodePlace(((Rvalue.Discriminant) rvalue).getPlace()));
        }
        return obj;
    }

    private static JsonObject encodeStatement(MirStatement stmt) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", stmt.getKind().name());
        switch (stmt.getKind()) {
            case ASSIGN: {
                MirStatement.Assign a = (MirStatement.Assign) stmt;
                obj.add("place", encodePlace(a.getPlace()));
                obj.add("rvalue", encodeRvalue(a.getRvalue()));
                if (!SourceInfo.UNKNOWN.equals(a.getSourceInfo())) obj.add("source", encodeSource(a.getSourceInfo()));
                break;
            }
            case STORAGE_LIVE:
                obj.addProperty("local", ((MirStatement.StorageLive) stmt).getLocal());
                break;
            case STORAGE_DEAD:
                obj.addProperty("local", ((MirStatement.StorageDead) stmt).getLocal());
                break;
            default:
                break;
        }
        return obj;
    }

    private static JsonObject encodeTerminator(MirTerminator term) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", term.getKind().name());
        switch (term.getKind()) {
            case GOTO:
                obj.addProperty("target", ((MirTerminator.Goto) term).getTarget());
                break;
            case SWITCH_INT: {
                MirTerminator.SwitchInt s = (MirTerminator.SwitchInt) term;
                obj.add("discriminant", encodeOperand(s.getDiscriminant()));
                obj.add("switchType", encodeType(s.getSwitchType()));
                JsonArray values = new JsonArray();
                for (BigInteger v : s.getTargets().getValues()) values.add(v.toString());
                obj.add("values", values);
                JsonArray targets = new JsonArray();
                for (int t : s.getTargets().getTargets()) targets.add(t);
                obj.add("targets", targets);
                obj.addProperty("otherwise", s.getTargets().getOtherwise());
                break;
            }
            case CALL: {
                MirTerminator.Call c = (MirTerminator.Call) term;
                obj.add("func", encodeOperand(c.getFunc()));
                obj.add("args", encodeOperands(c.getArgs()));
                obj.add("destination", c.getDestination() != null ? encodePlace(c.getDestination()) : JsonNull.INSTANCE);
                obj.addProperty("target", c.getTarget());
                obj.addProperty("cleanup", c.getCleanup());
                break;
            }
            case DROP: {
                MirTerminator.Drop d = (MirTerminator.Drop) term;
                obj.add("place", encodePlace(d.getPlace()));
                obj.addProperty("target", d.getTarget());
                obj.addProperty("unwind", d.getUnwind());
                break;
            }
            case ASSERT: {
                MirTerminator.Assert a = (MirTerminator.Assert) term;
                obj.add("condition", encodeOperand(a.getCondition()));
                obj.addProperty("expected", a.isExpected());
                JsonObject msg = new JsonObject();
                msg.addProperty("kind", a.getMessage().getKind().name());
                if (a.getMessage().getText() != null) msg.addProperty("text", a.getMessage().getText());
                obj.add("message", msg);
                obj.addProperty("target", a.getTarget());
                obj.addProperty("cleanup", a.getCleanup());
                break;
            }
            default:
                break;
        }
        return obj;
    }

    // ==================== 解码 ====================

    static MirProgram decodeProgram(JsonObject obj) {
        MirProgram program = new MirProgram();
        JsonArray functions = array(obj, "functions", "$");
        for (int i = 0; i < functions.size(); i++) {
            program.addFunction(decodeFunction(functions.get(i).getAsJsonObject(), "functions[" + i + "]"));
        }
        if (obj.has("constants")) {
            for (Map.Entry<String, JsonElement> e : obj.getAsJsonObject("constants").entrySet()) {
                program.addConstant(e.getKey(), decodeConstant(e.getValue().getAsJsonObject(), "constants." + e.getKey()));
            }
        }
        if (obj.has("externalFunctions")) {
            JsonArray externs = obj.getAsJsonArray("externalFunctions");
            for (int i = 0; i < externs.size(); i++) {
                String path = "externalFunctions[" + i + "]";
                JsonObject o = externs.get(i).getAsJsonObject();
                List<MirType> params = new ArrayList<>();
                for (JsonElement p : array(o, "params", path)) params.add(decodeType(p.getAsJsonObject(), path));
                program.addExternalFunction(new ExternalFunction(string(o, "name", path), params,
                        decodeType(object(o, "returnType", path), path),
                        enumValue(CallingConvention.class, string(o, "callingConvention", path), path),
                        o.has("variadic") && o.get("variadic").getAsBoolean()));
            }
        }
        if (obj.has("typeDefinitions")) {
            JsonArray types = obj.getAsJsonArray("typeDefinitions");
            for (int i = 0; i < types.size(); i++) {
                String path = "typeDefinitions[" + i + "]";
                JsonObject o = types.get(i).getAsJsonObject();
                Map<String, MirType> fields = new LinkedHashMap<>();
                for (Map.Entry<String, JsonElement> f : object(o, "fields", path).entrySet()) {
                    fields.put(f.getKey(), decodeType(f.getValue().getAsJsonObject(), path));
                }
                program.addTypeDefinition(new TypeDefinition(string(o, "name", path), fields));
            }
        }
        return program;
    }

    static MirFunction decodeFunction(JsonObject obj, String path) {
        MirFunction fn = new MirFunction(string(obj, "name", path), decodeType(object(obj, "returnType", path), path));
        for (JsonElement e : array(obj, "locals", path)) {
            JsonObject o = e.getAsJsonObject();
            JsonElement name = o.get("name");
            SourceInfo source = o.has("source") && o.get("source").isJsonObject()
                    ? decodeSource(o.getAsJsonObject("source")) : null;
            fn.addLocal(new MirLocal(integer(o, "id", path), name == null || name.isJsonNull() ? null : name.getAsString(),
                    decodeType(object(o, "type", path), path),
                    o.has("mutability") ? enumValue(Mutability.class, o.get("mutability").getAsString(), path) : Mutability.MUT,
                    source));
        }
        if (obj.has("params")) {
            for (JsonElement e : obj.getAsJsonArray("params")) {
                JsonObject o = e.getAsJsonObject();
                fn.addParam(new MirParam(string(o, "name", path), decodeType(object(o, "type", path), path),
                        integer(o, "local", path)));
            }
        }
        JsonArray blocks = array(obj, "blocks", path);
        for (int i = 0; i < blocks.size(); i++) {
            String blockPath = path + ".blocks[" + i + "]";
            JsonObject o = blocks.get(i).getAsJsonObject();
            BasicBlock block = new BasicBlock(integer(o, "id", blockPath));
            if (o.has("vectorWidth")) block.setVectorWidth(o.get("vectorWidth").getAsInt());
            JsonArray stmts = array(o, "statements", blockPath);
            for (int j = 0; j < stmts.size(); j++) {
                block.addStatement(decodeStatement(stmts.get(j).getAsJsonObject(), blockPath + ".statements[" + j + "]"));
            }
            block.setTerminator(decodeTerminator(object(o, "terminator", blockPath), blockPath + ".terminator"));
            fn.addBlock(block);
        }
        fn.setEntryBlock(obj.has("entry") ? obj.get("entry").getAsInt() : 0);
        fn.setReturnLocal(obj.has("returnLocal") ? obj.get("returnLocal").getAsInt() : -1);
        return fn;
    }

    static MirType decodeType(JsonObject obj, String path) {
        MirType.Kind kind = enumValue(MirType.Kind.class, string(obj, "kind", path), path);
        switch (kind) {
            case ARRAY:
                return MirType.ofArray(decodeType(object(obj, "element", path), path));
            case REF:
                return MirType.ofRef(decodeType(object(obj, "target", path), path),
                        enumValue(Mutability.class, string(obj, "mutability", path), path));
            case PTR:
                return MirType.ofPtr(decodeType(object(obj, "target", path), path));
            case NAMED:
                return MirType.ofNamed(string(obj, "name", path));
            default:
                return MirType.of(kind);
        }
    }

    static Constant decodeConstant(JsonObject obj, String path) {
        MirType type = decodeType(object(obj, "type", path), path);
        JsonObject v = object(obj, "value", path);
        ConstantValue.Kind kind = enumValue(ConstantValue.Kind.class, string(v, "kind", path), path);
        ConstantValue value;
        switch (kind) {
            case BOOL:
                value = ConstantValue.ofBool(require(v, "value", path).getAsBoolean());
                break;
            case INTEGER:
                value = ConstantValue.ofInteger(bigInteger(string(v, "value", path), path));
                break;
            case FLOAT:
                value = ConstantValue.ofFloat(require(v, "value", path).getAsDouble());
                break;
            case STRING:
                value = ConstantValue.ofString(string(v, "value", path));
                break;
            case CHAR:
                value = ConstantValue.ofChar(integer(v, "value", path));
                break;
            default:
                value = ConstantValue.ofNull();
                break;
        }
        return new Constant(type, value);
    }

    private static SourceInfo decodeSource(JsonObject obj) {
        return new SourceInfo(obj.has("file") ? obj.get("file").getAsString() : SourceInfo.UNKNOWN.getFile(),
                obj.has("line") ? obj.get("line").getAsInt() : 0,
                obj.has("column") ? obj.get("column").getAsInt() : 0);
    }

    private static Place decodePlace(JsonObject obj, String path) {
        int local = integer(obj, "local", path);
        if (!obj.has("projection")) return Place.of(local);
        List<Projection> proj = new ArrayList<>();
        for (JsonElement e : obj.getAsJsonArray("projection")) {
            JsonObject o = e.getAsJsonObject();
            Projection.Kind kind = enumValue(Projection.Kind.class, string(o, "kind", path), path);
            switch (kind) {
                case DEREF:
                    proj.add(Projection.deref());
                    break;
                case FIELD:
                    proj.add(Projection.field(integer(o, "index", path), decodeType(object(o, "type", path), path)));
                    break;
                case INDEX:
                    proj.add(Projection.index(integer(o, "local", path)));
                    break;
                default:
                    proj.add(Projection.subslice(require(o, "from", path).getAsLong(), require(o, "to", path).getAsLong()));
                    break;
            }
        }
        return new Place(local, proj);
    }

    private static Operand decodeOperand(JsonObject obj, String path) {
        Operand.Kind kind = enumValue(Operand.Kind.class, string(obj, "kind", path), path);
        switch (kind) {
            case COPY:
                return Operand.copy(decodePlace(object(obj, "place", path), path));
            case MOVE:
                return Operand.move(decodePlace(object(obj, "place", path), path));
            default:
                return Operand.constant(decodeConstant(object(obj, "constant", path), path));
        }
    }

    private static List<Operand> decodeOperands(JsonArray arr, String path) {
        List<Operand> result = new ArrayList<>();
        for (JsonElement e : arr) result.add(decodeOperand(e.getAsJsonObject(), path));
        return result;
    }

    private static Rvalue decodeRvalue(JsonObject obj, String path) {
        Rvalue.Kind kind = enumValue(Rvalue.Kind.class, string(obj, "kind", path), path);
        switch (kind) {
            case USE:
                return Rvalue.use(decodeOperand(object(obj, "operand", path), path));
            case BINARY_OP:
                return Rvalue.binary(enumValue(BinOp.class, string(obj, "op", path), path),
                        decodeOperand(object(obj, "left", path), path),
                        decodeOperand(object(obj, "right", path), path));
            case UNARY_OP:
                return Rvalue.unary(enumValue(UnOp.class, string(obj, "op", path), path),
                        decodeOperand(object(obj, "operand", path), path));
            case CALL:
                return Rvalue.call(decodeOperand(object(obj, "func", path), path),
                        decodeOperands(array(obj, "args", path), path));
            case AGGREGATE:
                return new Rvalue.Aggregate(decodeAggregateKind(object(obj, "aggregate", path), path),
                        decodeOperands(array(obj, "operands", path), path));
            case CAST:
                return new Rvalue.Cast(enumValue(CastKind.class, string(obj, "castKind", path), path),
                        decodeOperand(object(obj, "operand", path), path),
                        decodeType(object(obj, "type", path), path));
            case REF:
                return new Rvalue.Ref(decodePlace(object(obj, "place", path), path),
                        enumValue(Mutability.class, string(obj, "mutability", path), path));
            case LEN:
                return new Rvalue.Len(decodePlace(object(obj, "place", path), path));
            default:
                return new Rvalue.Discriminant(decodePlace(object(obj, "place", path), path));
        }
    }

    private static AggregateKind decodeAggregateKind(JsonObject obj, String path) {
        AggregateKind.Kind kind = enumValue(AggregateKind.Kind.class, string(obj, "kind", path), path);
        switch (kind) {
            case ARRAY:
                return AggregateKind.array(decodeType(object(obj, "element", path), path));
            case TUPLE:
                return AggregateKind.tuple();
            case STRUCT:
                return AggregateKind.struct(string(obj, "name", path));
            default:
                return AggregateKind.enumVariant(string(obj, "name", path), integer(obj, "variant", path));
        }
    }

    private static MirStatement decodeStatement(JsonObject obj, String path) {
        MirStatement.Kind kind = enumValue(MirStatement.Kind.class, string(obj, "kind", path), path);
        switch (kind) {
            case ASSIGN:
                return new MirStatement.Assign(decodePlace(object(obj, "place", path), path),
                        decodeRvalue(object(obj, "rvalue", path), path),
                        obj.has("source") ? decodeSource(obj.getAsJsonObject("source")) : null);
            case STORAGE_LIVE:
                return new MirStatement.StorageLive(integer(obj, "local", path));
            case STORAGE_DEAD:
                return new MirStatement.StorageDead(integer(obj, "local", path));
            default:
                return MirStatement.nop();
        }
    }

    private static MirTerminator decodeTerminator(JsonObject obj, String path) {
        MirTerminator.Kind kind = enumValue(MirTerminator.Kind.class, string(obj, "kind", path), path);
        switch (kind) {
            case GOTO:
                return MirTerminator.goTo(integer(obj, "target", path));
            case SWITCH_INT: {
                List<BigInteger> values = new ArrayList<>();
                for (JsonElement e : array(obj, "values", path)) values.add(bigInteger(e.getAsString(), path));
                List<Integer> targets = new ArrayList<>();
                for (JsonElement e : array(obj, "targets", path)) targets.add(e.getAsInt());
                if (values.size() != targets.size()) {
                    throw new IrFormatException("values 与 targets 数量不一致", path);
                }
                return new MirTerminator.SwitchInt(decodeOperand(object(obj, "discriminant", path), path),
                        decodeType(object(obj, "switchType", path), path),
                        new SwitchTargets(values, targets, integer(obj, "otherwise", path)));
            }
            case RETURN:
                return MirTerminator.returnValue();
            case UNREACHABLE:
                return MirTerminator.unreachable();
            case CALL: {
                JsonElement dest = obj.get("destination");
                return new MirTerminator.Call(decodeOperand(object(obj, "func", path), path),
                        decodeOperands(array(obj, "args", path), path),
                        dest == null || dest.isJsonNull() ? null : decodePlace(dest.getAsJsonObject(), path),
                        optionalBlock(obj, "target"), optionalBlock(obj, "cleanup"));
            }
            case DROP:
                return new MirTerminator.Drop(decodePlace(object(obj, "place", path), path),
                        integer(obj, "target", path), optionalBlock(obj, "unwind"));
            default: {
                JsonObject msg = object(obj, "message", path);
                AssertMessage.Kind msgKind = enumValue(AssertMessage.Kind.class, string(msg, "kind", path), path);
                AssertMessage message = msgKind == AssertMessage.Kind.CUSTOM
                        ? AssertMessage.custom(string(msg, "text", path)) : AssertMessage.of(msgKind);
                return new MirTerminator.Assert(decodeOperand(object(obj, "condition", path), path),
                        require(obj, "expected", path).getAsBoolean(), message,
                        integer(obj, "target", path), optionalBlock(obj, "cleanup"));
            }
        }
    }

    // ==================== 辅助 ====================

    private static JsonElement require(JsonObject obj, String field, String path) {
        JsonElement e = obj.get(field);
        if (e == null || e.isJsonNull()) {
            throw new IrFormatException("缺少字段 " + field, path);
        }
        return e;
    }

    private static String string(JsonObject obj, String field, String path) {
        JsonElement e = require(obj, field, path);
        if (!e.isJsonPrimitive()) throw new IrFormatException("字段 " + field + " 应为字符串", path);
        return e.getAsString();
    }

    private static int integer(JsonObject obj, String field, String path) {
        JsonElement e = require(obj, field, path);
        if (!e.isJsonPrimitive() || !((JsonPrimitive) e).isNumber()) {
            throw new IrFormatException("字段 " + field + " 应为整数", path);
        }
        return e.getAsInt();
    }

    private static int optionalBlock(JsonObject obj, String field) {
        JsonElement e = obj.get(field);
        return e == null || e.isJsonNull() ? MirTerminator.NO_BLOCK : e.getAsInt();
    }

    private static JsonObject object(JsonObject obj, String field, String path) {
        JsonElement e = require(obj, field, path);
        if (!e.isJsonObject()) throw new IrFormatException("字段 " + field + " 应为对象", path);
        return e.getAsJsonObject();
    }

    private static JsonArray array(JsonObject obj, String field, String path) {
        JsonElement e = require(obj, field, path);
        if (!e.isJsonArray()) throw new IrFormatException("字段 " + field + " 应为数组", path);
        return e.getAsJsonArray();
    }

    private static BigInteger bigInteger(String text, String path) {
        if (!text.matches("-?\\d+")) {
            throw new IrFormatException("无效整数: " + text, path);
        }
        return new BigInteger(text);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name, String path) {
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(name)) return constant;
        }
        throw new IrFormatException("未知的 " + type.getSimpleName() + ": " + name, path);
    }
}
