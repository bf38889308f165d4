package org.lambdareduce;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class LambdaEval {

    // =========================================================
    // Configuration
    // =========================================================
    private static final String CONFIG_FILE = "lambda.properties";
    private static final String INPUT_DIR = "input";
    private static final String INTERMEDIATE_DIR = "intermediate";
    private static final String OUTPUT_DIR = "output";
    private static final String INPUT_FILE = "input.json";
    private static final String OUTPUT_FILE = "output.json";
    private static final int DEFAULT_MAX_STEPS = 10000;

    // =========================================================
    // Entry
    // =========================================================
    public static void main(String[] args) {
        try {
            Config config = Config.load();
            if (args.length > 0) {
                runExpressions(Arrays.asList(args), config, System.out, System.err);
            } else {
                runBatch(config, System.out, System.err);
            }
        } catch (EvalException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace();
            System.exit(3);
        }
    }

    /**
     * Command-line mode: every argument is one expression.
     * Returns the number of expressions that failed to parse or reduce.
     */
    static int runExpressions(List<String> expressions, Config config, PrintStream out, PrintStream err) {
        int failures = 0;
        for (String text : expressions) {
            Term parsed;
            try {
                parsed = Parser.parse(text);
            } catch (SyntaxException e) {
                // Report and move on; nothing is reduced for a failed parse
                err.println("Syntax error: " + e.getMessage());
                failures++;
                continue;
            }
            out.println("Parsed expression: " + Printer.print(parsed));
            Normalization result;
            try {
                result = Batch.normalize(parsed, config.maxSteps, null);
            } catch (EvalException e) {
                err.println("ERROR: " + e.getMessage());
                failures++;
                continue;
            }
            if (!result.complete) {
                err.println("WARNING: no normal form after " + result.steps + " steps, showing last term");
            }
            out.println("Reduced expression: " + Printer.print(result.term));
        }
        return failures;
    }

    /**
     * Batch mode: reads input.json, reduces every expression and writes output.json.
     * With tracing on, each expression also gets an intermediate/expr_N.json with every step.
     */
    static ObjectNode runBatch(Config config, PrintStream out, PrintStream err) {
        JsonNode input = JsonUtil.loadInputJson(config);
        List<String> expressions = JsonUtil.readExpressions(input);
        out.println("Loaded " + INPUT_FILE + " (" + expressions.size() + " expressions)");

        if (config.trace) JsonUtil.clearIntermediateDir(config);

        ArrayNode results = JsonUtil.MAPPER.createArrayNode();
        for (int i = 0; i < expressions.size(); i++) {
            String text = expressions.get(i);
            out.println("\n=== Expression " + (i + 1) + " ===");
            out.println("  Input: " + text);

            List<String> trace = config.trace ? new ArrayList<>() : null;
            ObjectNode result = Batch.evaluate(text, config.maxSteps, trace);
            results.add(result);

            if (result.has("error")) {
                String kind = result.has("position") ? "Syntax error: " : "";
                err.println("WARNING: expression " + (i + 1) + " - " + kind + result.get("error").asText());
                continue;
            }
            if (!result.get("complete").asBoolean()) {
                err.println("WARNING: expression " + (i + 1) + " - step limit of " + config.maxSteps + " reached");
            }
            out.println("  Normal form: " + result.get("normalForm").asText() + " (" + result.get("steps").asInt() + " steps)");

            if (config.trace) {
                String traceFile = "expr_" + (i + 1) + ".json";
                JsonUtil.saveIntermediateJson(config, Batch.traceJson(text, trace), traceFile);
                out.println("  Saved trace: " + traceFile);
            }
        }

        ObjectNode output = JsonUtil.MAPPER.createObjectNode();
        output.set("results", results);
        JsonUtil.saveOutputJson(config, output);
        out.println("\n=== Saved final " + OUTPUT_FILE + " ===");
        return output;
    }

    // =========================================================
    // Config
    // =========================================================
    static final class Config {
        final int maxSteps;
        final boolean trace;
        final Path baseDir;
        final String inputDir;
        final String outputDir;
        final String intermediateDir;

        Config(int maxSteps, boolean trace, Path baseDir, String inputDir, String outputDir, String intermediateDir) {
            if (maxSteps < 0) throw new EvalException("CONFIG_ERROR: maxSteps must be >= 0");
            this.maxSteps = maxSteps;
            this.trace = trace;
            this.baseDir = baseDir;
            this.inputDir = inputDir;
            this.outputDir = outputDir;
            this.intermediateDir = intermediateDir;
        }

        static Config defaults(Path baseDir) {
            return new Config(DEFAULT_MAX_STEPS, true, baseDir, INPUT_DIR, OUTPUT_DIR, INTERMEDIATE_DIR);
        }

        static Config load() {
            return fromProperties(loadProperties(), defaultBaseDir());
        }

        static Config fromProperties(Properties p, Path baseDir) {
            return new Config(
                    parseIntProp(p, "maxSteps", DEFAULT_MAX_STEPS),
                    parseBoolProp(p, "trace", true),
                    baseDir,
                    p.getProperty("inputDir", INPUT_DIR).trim(),
                    p.getProperty("outputDir", OUTPUT_DIR).trim(),
                    p.getProperty("intermediateDir", INTERMEDIATE_DIR).trim());
        }

        private static Properties loadProperties() {
            Properties p = new Properties();
            try (InputStream in = LambdaEval.class.getResourceAsStream("/" + CONFIG_FILE)) {
                if (in != null) { p.load(in); return p; }
            } catch (IOException e) {
                throw new EvalException("CONFIG_ERROR: cannot read classpath " + CONFIG_FILE + " - " + e.getMessage());
            }
            File f = new File(CONFIG_FILE);
            if (f.isFile()) {
                try (InputStream in = new FileInputStream(f)) { p.load(in); } catch (IOException e) {
                    throw new EvalException("CONFIG_ERROR: cannot read " + f.getPath() + " - " + e.getMessage());
                }
            }
            return p;
        }

        // Prefer src/main/resources for development, fall back to current dir
        private static Path defaultBaseDir() {
            Path srcResources = Paths.get("src/main/resources");
            return Files.isDirectory(srcResources) ? srcResources : Paths.get(".");
        }

        private static int parseIntProp(Properties p, String key, int def) {
            String v = p.getProperty(key);
            if (v == null) return def;
            try { return Integer.parseInt(v.trim()); } catch (NumberFormatException e) {
                throw new EvalException("CONFIG_ERROR: bad integer for '" + key + "': " + v);
            }
        }

        private static boolean parseBoolProp(Properties p, String key, boolean def) {
            String v = p.getProperty(key);
            if (v == null) return def;
            return Boolean.parseBoolean(v.trim());
        }
    }

    // =========================================================
    // JSON Utilities
    // =========================================================
    static final class JsonUtil {
        static final ObjectMapper MAPPER = new ObjectMapper();

        // ----- File I/O -----

        /**
         * Load input.json from the configured input folder, falling back to the classpath.
         */
        static JsonNode loadInputJson(Config config) {
            Path file = config.baseDir.resolve(config.inputDir).resolve(INPUT_FILE);
            if (Files.isRegularFile(file)) {
                try {
                    return requireObject(MAPPER.readTree(file.toFile()));
                } catch (IOException e) {
                    throw new EvalException("PARSE_ERROR: cannot read " + file + " - " + e.getMessage());
                }
            }

            String resource = "/" + config.inputDir + "/" + INPUT_FILE;
            try (InputStream in = LambdaEval.class.getResourceAsStream(resource)) {
                if (in != null) return requireObject(MAPPER.readTree(in));
            } catch (IOException e) {
                throw new EvalException("PARSE_ERROR: cannot read classpath " + resource + " - " + e.getMessage());
            }

            throw new EvalException("PARSE_ERROR: cannot find " + INPUT_FILE + " in " + file.getParent() + " or on the classpath");
        }

        /**
         * Reads the "expressions" array; every entry must be a JSON string.
         */
        static List<String> readExpressions(JsonNode input) {
            JsonNode node = input.get("expressions");
            if (node == null || !node.isArray()) {
                throw new EvalException("PARSE_ERROR: " + INPUT_FILE + " must contain an \"expressions\" array");
            }
            List<String> expressions = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                JsonNode e = node.get(i);
                if (!e.isTextual()) throw new EvalException("PARSE_ERROR: expressions[" + i + "] must be a string");
                expressions.add(e.asText());
            }
            return expressions;
        }

        static void saveIntermediateJson(Config config, ObjectNode json, String filename) {
            saveToDir(config, json, config.intermediateDir, filename);
        }

        static void saveOutputJson(Config config, ObjectNode json) {
            saveToDir(config, json, config.outputDir, OUTPUT_FILE);
        }

        /**
         * Remove stale traces from a previous run.
         */
        static void clearIntermediateDir(Config config) {
            Path dir = config.baseDir.resolve(config.intermediateDir);
            if (!Files.isDirectory(dir)) return;
            try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
                for (Path p : files) Files.delete(p);
            } catch (IOException e) {
                throw new EvalException("IO_ERROR: cannot clear " + dir + " - " + e.getMessage());
            }
        }

        private static void saveToDir(Config config, ObjectNode json, String dirName, String filename) {
            Path dir = config.baseDir.resolve(dirName);
            try {
                Files.createDirectories(dir);
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(filename).toFile(), json);
            } catch (IOException e) {
                throw new EvalException("IO_ERROR: cannot write to " + dirName + "/" + filename + " - " + e.getMessage());
            }
        }

        private static JsonNode requireObject(JsonNode node) {
            if (node instanceof ObjectNode) return node;
            throw new EvalException("PARSE_ERROR: " + INPUT_FILE + " must be a JSON object");
        }
    }

    // =========================================================
    // Batch evaluation
    // =========================================================
    static final class Batch {
        /**
         * Parses and reduces one expression into a result object. A syntax error or a
         * term too deep to reduce is recorded in the result instead of being thrown.
         * Intermediate renderings go to {@code trace} unless it is null.
         */
        static ObjectNode evaluate(String text, int maxSteps, List<String> trace) {
            ObjectNode result = JsonUtil.MAPPER.createObjectNode();
            result.put("input", text);
            Term parsed;
            try {
                parsed = Parser.parse(text);
            } catch (SyntaxException e) {
                result.put("error", e.getMessage());
                result.put("position", e.getPosition());
                return result;
            }
            StepListener listener = null;
            if (trace != null) {
                trace.add(Printer.print(parsed));
                listener = (step, term) -> trace.add(Printer.print(term));
            }
            result.put("parsed", Printer.print(parsed));
            result.set("ast", TermJson.toJson(parsed));
            Normalization n;
            try {
                n = normalize(parsed, maxSteps, listener);
            } catch (EvalException e) {
                result.put("error", e.getMessage());
                return result;
            }
            result.put("normalForm", Printer.print(n.term));
            result.put("steps", n.steps);
            result.put("complete", n.complete);
            return result;
        }

        /**
         * Bounded normalization for the driver. Substitution and reduction recurse on term
         * depth, so a term that outgrows the thread stack fails this expression only.
         */
        static Normalization normalize(Term t, int maxSteps, StepListener listener) {
            try {
                return Reducer.normalize(t, maxSteps, listener);
            } catch (StackOverflowError e) {
                throw new EvalException("DEPTH_ERROR: term nested too deeply to reduce");
            }
        }

        static ObjectNode traceJson(String text, List<String> trace) {
            ObjectNode node = JsonUtil.MAPPER.createObjectNode();
            node.put("input", text);
            ArrayNode steps = node.putArray("trace");
            for (String s : trace) steps.add(s);
            return node;
        }
    }

    // =========================================================
    // Terms
    // =========================================================
    interface Term { <R> R accept(TermVisitor<R> v); }

    /** One method per term shape; a new shape must be handled by every visitor. */
    interface TermVisitor<R> {
        R visitVar(Var v);
        R visitLam(Lam l);
        R visitApp(App a);
    }

    static final class Var implements Term {
        final int name; // code point
        Var(int name){ this.name = name; }
        public <R> R accept(TermVisitor<R> v){ return v.visitVar(this); }
        boolean sameName(Var other){ return name == other.name; }
        @Override public boolean equals(Object o){ return o instanceof Var && ((Var) o).name == name; }
        @Override public int hashCode(){ return Integer.hashCode(name); }
        @Override public String toString(){ return Printer.print(this); }
    }

    static final class Lam implements Term {
        final Var param; final Term body;
        Lam(Var param, Term body){ this.param = Objects.requireNonNull(param); this.body = Objects.requireNonNull(body); }
        public <R> R accept(TermVisitor<R> v){ return v.visitLam(this); }
        @Override public boolean equals(Object o){
            if (!(o instanceof Lam)) return false;
            Lam l = (Lam) o;
            return param.equals(l.param) && body.equals(l.body);
        }
        @Override public int hashCode(){ return 31 * param.hashCode() + body.hashCode(); }
        @Override public String toString(){ return Printer.print(this); }
    }

    static final class App implements Term {
        final Term fn; final Term arg;
        App(Term fn, Term arg){ this.fn = Objects.requireNonNull(fn); this.arg = Objects.requireNonNull(arg); }
        public <R> R accept(TermVisitor<R> v){ return v.visitApp(this); }
        @Override public boolean equals(Object o){
            if (!(o instanceof App)) return false;
            App a = (App) o;
            return fn.equals(a.fn) && arg.equals(a.arg);
        }
        @Override public int hashCode(){ return 17 * fn.hashCode() + arg.hashCode(); }
        @Override public String toString(){ return Printer.print(this); }
    }

    /**
     * Renders with an explicit work stack, so output of any depth fits the thread stack.
     * Pending entries are either terms still to print or literal closing text.
     */
    static final class Printer implements TermVisitor<Void> {
        private final StringBuilder sb = new StringBuilder();
        private final Deque<Object> work = new ArrayDeque<>();

        static String print(Term t) {
            Printer p = new Printer();
            p.work.push(t);
            while (!p.work.isEmpty()) {
                Object next = p.work.pop();
                if (next instanceof Term) ((Term) next).accept(p);
                else p.sb.append((String) next);
            }
            return p.sb.toString();
        }

        public Void visitVar(Var v){ sb.appendCodePoint(v.name); return null; }
        public Void visitLam(Lam l){
            sb.append('(').append(Parser.LAMBDA).appendCodePoint(l.param.name).append('.');
            work.push(")");
            work.push(l.body);
            return null;
        }
        public Void visitApp(App a){
            sb.append('(');
            work.push(")");
            work.push(a.arg);
            work.push(" ");
            work.push(a.fn);
            return null;
        }
    }

    static final class TermJson implements TermVisitor<ObjectNode> {
        private static final TermJson INSTANCE = new TermJson();

        static ObjectNode toJson(Term t){ return t.accept(INSTANCE); }

        public ObjectNode visitVar(Var v){
            ObjectNode n = JsonUtil.MAPPER.createObjectNode();
            n.put("type", "var");
            n.put("name", new String(Character.toChars(v.name)));
            return n;
        }
        public ObjectNode visitLam(Lam l){
            ObjectNode n = JsonUtil.MAPPER.createObjectNode();
            n.put("type", "lam");
            n.put("param", new String(Character.toChars(l.param.name)));
            n.set("body", l.body.accept(this));
            return n;
        }
        public ObjectNode visitApp(App a){
            ObjectNode n = JsonUtil.MAPPER.createObjectNode();
            n.put("type", "app");
            n.set("function", a.fn.accept(this));
            n.set("argument", a.arg.accept(this));
            return n;
        }
    }

    // =========================================================
    // Exceptions
    // =========================================================
    static class EvalException extends RuntimeException {
        EvalException(String msg){ super(msg); }
    }

    static final class SyntaxException extends EvalException {
        private final int position;
        SyntaxException(String msg, int position){ super(msg); this.position = position; }
        /** Index into the whitespace-stripped input where the error was detected. */
        int getPosition(){ return position; }
    }

    // =========================================================
    // Parser
    // =========================================================
    static final class ParserState {
        final String s; int pos = 0;
        ParserState(String s){ this.s = s; }
        boolean atEnd(){ return pos >= s.length(); }
        char peek(){ return s.charAt(pos); }
        int peekCodePoint(){ return s.codePointAt(pos); }
        void skipCodePoint(int cp){ pos += Character.charCount(cp); }
        SyntaxException error(String msg){ return new SyntaxException(msg, pos); }
    }

    /**
     * Recursive descent over single-character tokens:
     * <pre>
     * Expr     ::= Lambda | AppChain
     * Lambda   ::= ('λ' | '\') Letter '.' Expr
     * AppChain ::= Factor Factor*
     * Factor   ::= '(' Expr ')' | Lambda | Letter
     * </pre>
     */
    static final class Parser {
        static final char LAMBDA = 'λ';
        static final char BACKSLASH = '\\';

        static Term parse(String text) {
            ParserState st = new ParserState(stripWhitespace(text));
            Term t = parseExpr(st);
            if (!st.atEnd()) throw st.error("Extra characters after valid expression");
            return t;
        }

        static String stripWhitespace(String text) {
            StringBuilder sb = new StringBuilder(text.length());
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                // isSpaceChar also covers no-break spaces
                if (!Character.isWhitespace(c) && !Character.isSpaceChar(c)) sb.append(c);
            }
            return sb.toString();
        }

        private static Term parseExpr(ParserState st) {
            if (!st.atEnd() && isLambda(st.peek())) return parseLambda(st);
            return parseApp(st);
        }

        private static Term parseLambda(ParserState st) {
            st.pos++; // λ or backslash, already checked by the caller
            if (st.atEnd() || !Character.isLetter(st.peekCodePoint())) throw st.error("Expected a variable after lambda");
            Var param = new Var(st.peekCodePoint());
            st.skipCodePoint(param.name);
            if (st.atEnd() || st.peek() != '.') throw st.error("Expected dot after lambda variable");
            st.pos++;
            return new Lam(param, parseExpr(st));
        }

        // Left-associative: each new factor wraps what has been parsed so far
        private static Term parseApp(ParserState st) {
            Term left = parseFactor(st);
            while (!st.atEnd() && st.peek() != ')' && st.peek() != '.') {
                left = new App(left, parseFactor(st));
            }
            return left;
        }

        private static Term parseFactor(ParserState st) {
            if (st.atEnd()) throw st.error("Unexpected end of input");
            char c = st.peek();
            if (c == '(') {
                st.pos++;
                Term inner = parseExpr(st);
                if (st.atEnd() || st.peek() != ')') throw st.error("Expected ')'");
                st.pos++;
                return inner;
            }
            if (isLambda(c)) return parseLambda(st);
            int cp = st.peekCodePoint();
            if (Character.isLetter(cp)) {
                st.skipCodePoint(cp);
                return new Var(cp);
            }
            throw st.error("Unexpected character: " + new String(Character.toChars(cp)));
        }

        private static boolean isLambda(char c){ return c == LAMBDA || c == BACKSLASH; }
    }

    // =========================================================
    // Substitution
    // =========================================================

    /**
     * body[target := replacement]. Stops at an abstraction that rebinds the target;
     * does not rename binders, so free variables of the replacement can be captured.
     */
    static final class Substitution implements TermVisitor<Term> {
        private final Var target; private final Term replacement;
        private Substitution(Var target, Term replacement){ this.target = target; this.replacement = replacement; }

        static Term substitute(Term expr, Var target, Term replacement) {
            return expr.accept(new Substitution(target, replacement));
        }

        public Term visitVar(Var v){ return v.sameName(target) ? replacement : v; }
        public Term visitLam(Lam l){
            if (l.param.sameName(target)) return l;
            return new Lam(l.param, l.body.accept(this));
        }
        public Term visitApp(App a){ return new App(a.fn.accept(this), a.arg.accept(this)); }
    }

    // =========================================================
    // Reduction
    // =========================================================
    static final class Step {
        final Term term; final boolean changed;
        private Step(Term term, boolean changed){ this.term = term; this.changed = changed; }
        static Step changed(Term t){ return new Step(t, true); }
        static Step unchanged(Term t){ return new Step(t, false); }
    }

    static final class Normalization {
        final Term term; final int steps; final boolean complete;
        Normalization(Term term, int steps, boolean complete){ this.term = term; this.steps = steps; this.complete = complete; }
    }

    interface StepListener { void onStep(int step, Term term); }

    static final class Reducer implements TermVisitor<Step> {
        private static final Reducer INSTANCE = new Reducer();

        /**
         * One beta step. A redex at the top is contracted first; otherwise the function
         * side is searched before the argument, and an abstraction's body last.
         */
        static Step reduceStep(Term t){ return t.accept(INSTANCE); }

        /** Reduces until no step applies. Does not return for terms without a normal form. */
        static Term normalize(Term t) {
            Step s = reduceStep(t);
            while (s.changed) s = reduceStep(s.term);
            return s.term;
        }

        /**
         * Like {@link #normalize(Term)} but gives up after maxSteps contractions.
         * The listener, if any, sees every intermediate term.
         */
        static Normalization normalize(Term t, int maxSteps, StepListener listener) {
            if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must be >= 0: " + maxSteps);
            Term current = t;
            int steps = 0;
            while (true) {
                Step s = reduceStep(current);
                if (!s.changed) return new Normalization(current, steps, true);
                if (steps == maxSteps) return new Normalization(current, steps, false);
                current = s.term;
                steps++;
                if (listener != null) listener.onStep(steps, current);
            }
        }

        public Step visitVar(Var v){ return Step.unchanged(v); }

        public Step visitLam(Lam l){
            Step body = l.body.accept(this);
            return body.changed ? Step.changed(new Lam(l.param, body.term)) : Step.unchanged(l);
        }

        public Step visitApp(App a){
            if (a.fn instanceof Lam) {
                Lam f = (Lam) a.fn;
                return Step.changed(Substitution.substitute(f.body, f.param, a.arg));
            }
            Step fn = a.fn.accept(this);
            if (fn.changed) return Step.changed(new App(fn.term, a.arg));
            Step arg = a.arg.accept(this);
            if (arg.changed) return Step.changed(new App(a.fn, arg.term));
            return Step.unchanged(a);
        }
    }
}
