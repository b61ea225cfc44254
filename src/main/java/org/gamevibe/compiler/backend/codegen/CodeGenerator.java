package org.gamevibe.compiler.backend.codegen;

import org.gamevibe.compiler.api.CompilerOptions;
import org.gamevibe.compiler.api.SourceMapping;
import org.gamevibe.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.BehaviorNode;
import org.gamevibe.compiler.frontend.parser.ast.Declaration;
import org.gamevibe.compiler.frontend.parser.ast.DeclarationVisitor;
import org.gamevibe.compiler.frontend.parser.ast.EntityNode;
import org.gamevibe.compiler.frontend.parser.ast.EventNode;
import org.gamevibe.compiler.frontend.parser.ast.GameNode;
import org.gamevibe.compiler.frontend.parser.ast.ObjectLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.Program;
import org.gamevibe.compiler.frontend.parser.ast.PropertyNode;
import org.gamevibe.compiler.frontend.parser.ast.SceneNode;
import org.gamevibe.compiler.frontend.parser.ast.SpawnNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The final stage of the compiler. It walks a semantically valid {@link Program} and emits one
 * TypeScript module that builds the described game against the runtime API.
 * <p>
 * Generation is syntax-directed and deterministic. Values that do not have the expected shape
 * (for example a {@code size} that is not a pair) are skipped rather than reported; reporting is
 * the job of the semantic analyzer.
 */
public class CodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    private static final Set<String> RESERVED_WORDS = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do",
            "else", "enum", "export", "extends", "false", "finally", "for", "function", "if", "import", "in",
            "instanceof", "new", "null", "return", "super", "switch", "this", "throw", "true", "try",
            "typeof", "var", "void", "while", "with", "let", "static", "yield", "await");

    /**
     * Generates the TypeScript module for the given program.
     *
     * @param program The program. Must have passed semantic analysis.
     * @param options The compiler options; {@code debug} and {@code sourceMap} affect the output.
     * @return The generated code and, if requested, its source map.
     */
    public GeneratedCode generate(Program program, CompilerOptions options) {
        Emission emission = new Emission(options);
        emission.emitProgram(program);
        LOG.debug("Generated {} lines for {} declarations", emission.out.nextLine() - 1, program.body().size());
        return new GeneratedCode(emission.out.text(), options.sourceMap() ? emission.mappings : List.of());
    }

    /**
     * The state of a single {@link #generate} call.
     */
    private static final class Emission implements DeclarationVisitor<Void> {

        private final CompilerOptions options;
        private final CodeWriter out = new CodeWriter();
        private final List<SourceMapping> mappings = new ArrayList<>();
        private GameNode game;

        Emission(CompilerOptions options) {
            this.options = options;
        }

        void emitProgram(Program program) {
            if (options.debug()) {
                out.line("// Generated by the GDL compiler (debug build)");
                out.line("// Declarations: " + program.body().size());
                out.blank();
            }
            emitImports();
            for (Declaration declaration : program.body()) {
                if (declaration instanceof GameNode && game != null) {
                    // Only the first game declaration configures the game.
                    continue;
                }
                out.blank();
                if (options.debug()) {
                    out.comment(declaration.keyword() + " declared at " + declaration.range().start());
                }
                mappings.add(new SourceMapping(out.nextLine(), declaration.range().start(), declaration.describe()));
                declaration.accept(this);
            }
            out.blank();
            emitMain(program);
        }

        private void emitImports() {
            String root = options.runtimeModuleRoot();
            Set<String> imports = new LinkedHashSet<>();
            imports.add("import { GameEngine } from " + ValueSerializer.quote(root + "/GameEngine") + ";");
            imports.add("import { Entity } from " + ValueSerializer.quote(root + "/ecs/Entity") + ";");
            imports.add("import { ComponentType } from " + ValueSerializer.quote(root + "/types") + ";");
            imports.add("import { Vector2 } from " + ValueSerializer.quote(root + "/math/Vector2") + ";");
            imports.forEach(out::line);
        }

        @Override
        public Void visitGame(GameNode game) {
            this.game = game;
            out.line("// Game Configuration");
            out.open("export const gameConfig = {");
            for (PropertyNode property : game.properties()) {
                out.line(ValueSerializer.key(property.name()) + ": " + ValueSerializer.serialize(property.value()) + ",");
            }
            out.close("};");
            return null;
        }

        @Override
        public Void visitEntity(EntityNode entity) {
            out.line("// Entity: " + entity.name());
            out.open("export class " + entity.name() + " extends Entity {");
            out.open("constructor(id: string, name: string, scene: string) {");
            out.line("super(id, name, scene);");
            out.line("this.setupComponents();");
            out.close("}");
            out.blank();
            out.open("private setupComponents(): void {");

            out.line("// Add transform component");
            out.open("this.addComponent(ComponentType.Transform, {");
            out.line("position: { x: 0, y: 0 },");
            out.line("rotation: 0,");
            Optional<List<ValueNode>> size = pair(entity.property("size"));
            if (size.isPresent()) {
                out.line("scale: { x: 1, y: 1 },");
                out.line("size: { width: " + ValueSerializer.serialize(size.get().get(0))
                        + ", height: " + ValueSerializer.serialize(size.get().get(1)) + " }");
            } else {
                out.line("scale: { x: 1, y: 1 }");
            }
            out.close("});");

            entity.property("sprite").ifPresent(sprite -> {
                out.blank();
                out.line("// Add sprite component");
                out.open("this.addComponent(ComponentType.Sprite, {");
                out.line("texture: " + ValueSerializer.serialize(sprite.value()) + ",");
                out.line("alpha: 1,");
                out.line("visible: true");
                out.close("});");
            });

            entity.property("physics").ifPresent(physics -> {
                out.blank();
                out.line("// Add physics component");
                out.open("this.addComponent(ComponentType.Physics, {");
                out.line("mode: " + ValueSerializer.serialize(physics.value()) + ",");
                out.line("velocity: { x: 0, y: 0 },");
                out.line("acceleration: { x: 0, y: 0 }");
                out.close("});");
            });

            entity.property("properties")
                    .filter(p -> p.value() instanceof ObjectLiteralNode)
                    .ifPresent(custom -> {
                        out.blank();
                        out.line("// Set custom properties");
                        for (PropertyNode property : ((ObjectLiteralNode) custom.value()).properties()) {
                            out.line("this.setProperty(" + ValueSerializer.quote(property.name()) + ", "
                                    + ValueSerializer.serialize(property.value()) + ");");
                        }
                    });

            List<String> behaviors = entity.behaviorNames();
            if (!behaviors.isEmpty()) {
                out.blank();
                out.line("// Apply behaviors");
                out.line("this.applyBehaviors(" + behaviors.stream().map(ValueSerializer::quote)
                        .collect(Collectors.joining(", ", "[", "]")) + ");");
            }
            out.close("}");
            out.close("}");
            return null;
        }

        @Override
        public Void visitBehavior(BehaviorNode behavior) {
            out.line("// Behavior: " + behavior.name());
            out.open("export class " + behavior.name() + "Behavior {");
            boolean first = true;

            Optional<ObjectLiteralNode> fields = objectProperty(behavior, "properties");
            if (fields.isPresent()) {
                out.line("// Properties");
                for (PropertyNode field : fields.get().properties()) {
                    out.line(ValueSerializer.key(field.name()) + ": " + TypeScriptType.of(field.value()) + " = "
                            + ValueSerializer.serialize(field.value()) + ";");
                }
                first = false;
            }

            Optional<ObjectLiteralNode> methods = objectProperty(behavior, "methods");
            if (methods.isPresent()) {
                for (PropertyNode method : methods.get().properties()) {
                    if (!first) out.blank();
                    out.open(ValueSerializer.key(method.name()) + "(): void {");
                    out.line("// Method implementation");
                    out.close("}");
                    first = false;
                }
            }

            if (behavior.property("update").isPresent()) {
                if (!first) out.blank();
                out.open("update(entity: Entity, deltaTime: number): void {");
                out.line("// Update implementation");
                out.close("}");
            }
            out.close("}");
            return null;
        }

        @Override
        public Void visitScene(SceneNode scene) {
            out.line("// Scene: " + scene.name());
            out.open("export class " + scene.name() + "Scene {");
            out.line("private engine: GameEngine;");
            out.line("private entities: Map<string, Entity> = new Map();");
            out.blank();
            out.open("constructor(engine: GameEngine) {");
            out.line("this.engine = engine;");
            out.close("}");
            out.blank();
            out.open("initialize(): void {");
            boolean first = true;

            if (!scene.properties().isEmpty()) {
                out.line("// Apply scene properties");
                for (PropertyNode property : scene.properties()) {
                    out.line("this.engine.setSceneProperty(" + ValueSerializer.quote(property.name()) + ", "
                            + ValueSerializer.serialize(property.value()) + ");");
                }
                first = false;
            }

            if (!scene.spawns().isEmpty()) {
                if (!first) out.blank();
                out.line("// Spawn entities");
                Set<String> locals = new HashSet<>();
                for (SpawnNode spawn : scene.spawns()) {
                    String local = uniqueLocal(spawn, locals);
                    out.line("const " + local + " = this.engine.spawnEntity(" + ValueSerializer.quote(spawn.entityType())
                            + ", " + ExpressionRenderer.render(spawn.position()) + ");");
                    if (spawn.name() != null) {
                        out.line("this.entities.set(" + ValueSerializer.quote(spawn.name()) + ", " + local + ");");
                    }
                }
                first = false;
            }

            List<EventNode> events = scene.events();
            if (!events.isEmpty()) {
                if (!first) out.blank();
                out.line("// Setup event handlers");
                for (int i = 0; i < events.size(); i++) {
                    out.line("this.engine.onEvent(" + ValueSerializer.quote(events.get(i).trigger())
                            + ", () => this.handleEvent" + (i + 1) + "());");
                }
            }
            out.close("}");

            for (int i = 0; i < events.size(); i++) {
                EventNode event = events.get(i);
                out.blank();
                out.open("private handleEvent" + (i + 1) + "(): void {");
                out.comment(event.keyword() + " " + event.trigger());
                out.close("}");
            }

            out.blank();
            out.open("update(deltaTime: number): void {");
            out.line("// Scene update logic");
            out.close("}");
            out.blank();
            out.open("cleanup(): void {");
            out.line("this.entities.clear();");
            out.close("}");
            out.close("}");
            return null;
        }

        private void emitMain(Program program) {
            out.line("// Main game initialization");
            out.open("export function initializeGame(engine: GameEngine): void {");
            if (game != null) {
                List<PropertyNode> settings = game.properties().stream()
                        .filter(p -> !p.name().equals("defaultScene"))
                        .toList();
                out.open("engine.updateConfig({");
                for (PropertyNode setting : settings) {
                    if (setting.name().equals("size")) {
                        pair(Optional.of(setting)).ifPresent(size -> {
                            out.line("width: " + ValueSerializer.serialize(size.get(0)) + ",");
                            out.line("height: " + ValueSerializer.serialize(size.get(1)) + ",");
                        });
                    } else {
                        out.line(ValueSerializer.key(setting.name()) + ": " + ValueSerializer.serialize(setting.value()) + ",");
                    }
                }
                out.close("});");
                game.property("defaultScene").ifPresent(scene -> {
                    out.blank();
                    out.line("// Load default scene");
                    out.line("loadScene(engine, " + ValueSerializer.serialize(scene.value()) + ");");
                });
            }
            out.close("}");
            out.blank();

            out.line("// Helper function to load scenes");
            out.open("export function loadScene(engine: GameEngine, sceneName: string): void {");
            out.line("const SceneClass = SceneRegistry[sceneName];");
            out.open("if (SceneClass) {");
            out.line("const scene = new SceneClass(engine);");
            out.line("scene.initialize();");
            out.middle("} else {");
            out.line("console.error(`Scene ${sceneName} not found`);");
            out.close("}");
            out.close("}");

            emitRegistry("EntityRegistry", program, EntityNode.class, "");
            emitRegistry("BehaviorRegistry", program, BehaviorNode.class, "Behavior");
            emitRegistry("SceneRegistry", program, SceneNode.class, "Scene");
        }

        private void emitRegistry(String registry, Program program, Class<? extends Declaration> kind, String suffix) {
            out.blank();
            out.open("export const " + registry + ": Record<string, any> = {");
            for (Declaration declaration : program.body()) {
                if (kind.isInstance(declaration)) {
                    String name = name(declaration);
                    out.line(ValueSerializer.key(name) + ": " + name + suffix + ",");
                }
            }
            out.close("};");
        }

        private static String name(Declaration declaration) {
            if (declaration instanceof EntityNode entity) return entity.name();
            if (declaration instanceof BehaviorNode behavior) return behavior.name();
            if (declaration instanceof SceneNode scene) return scene.name();
            return declaration.keyword();
        }

        private static String uniqueLocal(SpawnNode spawn, Set<String> locals) {
            String base = spawn.name() != null ? spawn.name() : spawn.entityType().toLowerCase(Locale.ROOT);
            if (RESERVED_WORDS.contains(base)) {
                base = base + "Entity";
            }
            String candidate = base;
            for (int n = 2; !locals.add(candidate); n++) {
                candidate = base + n;
            }
            return candidate;
        }

        private static Optional<List<ValueNode>> pair(Optional<PropertyNode> property) {
            return property
                    .map(PropertyNode::value)
                    .filter(v -> v instanceof ArrayLiteralNode array && array.elements().size() == 2)
                    .map(v -> ((ArrayLiteralNode) v).elements());
        }

        private static Optional<ObjectLiteralNode> objectProperty(Declaration declaration, String name) {
            return declaration.property(name)
                    .map(PropertyNode::value)
                    .filter(ObjectLiteralNode.class::isInstance)
                    .map(ObjectLiteralNode.class::cast);
        }
    }
}
