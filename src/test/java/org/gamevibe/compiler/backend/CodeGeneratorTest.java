package org.gamevibe.compiler.backend;

import org.gamevibe.compiler.api.CompilerOptions;
import org.gamevibe.compiler.api.SourceMapping;
import org.gamevibe.compiler.api.SourcePosition;
import org.gamevibe.compiler.backend.codegen.CodeGenerator;
import org.gamevibe.compiler.backend.codegen.GeneratedCode;
import org.gamevibe.compiler.frontend.lexer.Lexer;
import org.gamevibe.compiler.frontend.parser.ParseResult;
import org.gamevibe.compiler.frontend.parser.Parser;
import org.gamevibe.compiler.frontend.parser.ast.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link CodeGenerator}.
 * The expected blocks mirror the runtime API the generated module is written against.
 */
public class CodeGeneratorTest {

    private static final CompilerOptions OPTIONS =
            new CompilerOptions(false, false, false, "./core", List.of("sprite"));

    private final CodeGenerator generator = new CodeGenerator();

    private static Program parse(String... lines) {
        ParseResult result = new Parser(new Lexer(String.join("\n", lines)).tokenize()).parse();
        assertThat(result.diagnostics()).as("syntax errors").isEmpty();
        return result.program();
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    /**
     * Verifies the import header and that it follows the configured runtime module root.
     */
    @Test
    @Tag("unit")
    void testImportsUseRuntimeModuleRoot() {
        // Arrange
        CompilerOptions options = new CompilerOptions(false, false, false, "./runtime", List.of());

        // Act
        String code = generator.generate(parse("entity A { }"), options).code();

        // Assert
        assertThat(code).startsWith(lines(
                "import { GameEngine } from \"./runtime/GameEngine\";",
                "import { Entity } from \"./runtime/ecs/Entity\";",
                "import { ComponentType } from \"./runtime/types\";",
                "import { Vector2 } from \"./runtime/math/Vector2\";",
                "",
                "// Entity: A"));
    }

    /**
     * Verifies that the game block becomes a config object with identifiers rendered as strings.
     */
    @Test
    @Tag("unit")
    void testGameConfiguration() {
        // Act
        String code = generator.generate(
                parse("game { title: \"Demo\", size: [800, 600], defaultScene: Main, pixelArt: true }"), OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "// Game Configuration",
                "export const gameConfig = {",
                "  title: \"Demo\",",
                "  size: [800, 600],",
                "  defaultScene: \"Main\",",
                "  pixelArt: true,",
                "};"));
        assertThat(code).contains(lines(
                "// Main game initialization",
                "export function initializeGame(engine: GameEngine): void {",
                "  engine.updateConfig({",
                "    title: \"Demo\",",
                "    width: 800,",
                "    height: 600,",
                "    pixelArt: true,",
                "  });",
                "",
                "  // Load default scene",
                "  loadScene(engine, \"Main\");",
                "}"));
    }

    /**
     * Verifies the complete entity class including all optional components.
     */
    @Test
    @Tag("unit")
    void testEntityClass() {
        // Arrange
        Program program = parse(
                "entity Player {",
                "  sprite: \"player.png\"",
                "  physics: platformer",
                "  size: [32, 48]",
                "  properties: { health: 100, \"max-speed\": 5 }",
                "  behaviors: [Jump, \"Run\"]",
                "}");

        // Act
        String code = generator.generate(program, OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "// Entity: Player",
                "export class Player extends Entity {",
                "  constructor(id: string, name: string, scene: string) {",
                "    super(id, name, scene);",
                "    this.setupComponents();",
                "  }",
                "",
                "  private setupComponents(): void {",
                "    // Add transform component",
                "    this.addComponent(ComponentType.Transform, {",
                "      position: { x: 0, y: 0 },",
                "      rotation: 0,",
                "      scale: { x: 1, y: 1 },",
                "      size: { width: 32, height: 48 }",
                "    });",
                "",
                "    // Add sprite component",
                "    this.addComponent(ComponentType.Sprite, {",
                "      texture: \"player.png\",",
                "      alpha: 1,",
                "      visible: true",
                "    });",
                "",
                "    // Add physics component",
                "    this.addComponent(ComponentType.Physics, {",
                "      mode: \"platformer\",",
                "      velocity: { x: 0, y: 0 },",
                "      acceleration: { x: 0, y: 0 }",
                "    });",
                "",
                "    // Set custom properties",
                "    this.setProperty(\"health\", 100);",
                "    this.setProperty(\"max-speed\", 5);",
                "",
                "    // Apply behaviors",
                "    this.applyBehaviors([\"Jump\"]);",
                "  }",
                "}"));
    }

    /**
     * Verifies that an entity without components only gets a transform without a size.
     */
    @Test
    @Tag("unit")
    void testMinimalEntity() {
        // Act
        String code = generator.generate(parse("entity Rock { size: 3 }"), OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "    this.addComponent(ComponentType.Transform, {",
                "      position: { x: 0, y: 0 },",
                "      rotation: 0,",
                "      scale: { x: 1, y: 1 }",
                "    });",
                "  }",
                "}"));
        assertThat(code).doesNotContain("ComponentType.Sprite", "applyBehaviors");
    }

    /**
     * Verifies the behavior class with typed fields, method stubs and an update hook.
     */
    @Test
    @Tag("unit")
    void testBehaviorClass() {
        // Arrange
        Program program = parse(
                "behavior Jump {",
                "  properties: { force: 300, label: \"j\", enabled: true, keys: [\"up\"], extra: { a: 1 } }",
                "  methods: { jump: true }",
                "  update: true",
                "}");

        // Act
        String code = generator.generate(program, OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "// Behavior: Jump",
                "export class JumpBehavior {",
                "  // Properties",
                "  force: number = 300;",
                "  label: string = \"j\";",
                "  enabled: boolean = true;",
                "  keys: string[] = [\"up\"];",
                "  extra: Record<string, any> = { a: 1 };",
                "",
                "  jump(): void {",
                "    // Method implementation",
                "  }",
                "",
                "  update(entity: Entity, deltaTime: number): void {",
                "    // Update implementation",
                "  }",
                "}"));
    }

    /**
     * Verifies scene initialization: properties, spawns with unique locals, events and handlers.
     */
    @Test
    @Tag("unit")
    void testSceneClass() {
        // Arrange
        Program program = parse(
                "scene Level {",
                "  size: [1600, 600]",
                "  spawn Player at [100, 200] as hero",
                "  spawn Coin at [1, 2]",
                "  spawn Coin at (x, y - 5)",
                "  spawn New at [0]",
                "  when player touches coin: score += 1",
                "}");

        // Act
        String code = generator.generate(program, OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "// Scene: Level",
                "export class LevelScene {",
                "  private engine: GameEngine;",
                "  private entities: Map<string, Entity> = new Map();",
                "",
                "  constructor(engine: GameEngine) {",
                "    this.engine = engine;",
                "  }",
                "",
                "  initialize(): void {",
                "    // Apply scene properties",
                "    this.engine.setSceneProperty(\"size\", [1600, 600]);",
                "",
                "    // Spawn entities",
                "    const hero = this.engine.spawnEntity(\"Player\", new Vector2(100, 200));",
                "    this.entities.set(\"hero\", hero);",
                "    const coin = this.engine.spawnEntity(\"Coin\", new Vector2(1, 2));",
                "    const coin2 = this.engine.spawnEntity(\"Coin\", new Vector2(x, y - 5));",
                "    const newEntity = this.engine.spawnEntity(\"New\", new Vector2(0, 0));",
                "",
                "    // Setup event handlers",
                "    this.engine.onEvent(\"player touches coin\", () => this.handleEvent1());",
                "  }",
                "",
                "  private handleEvent1(): void {",
                "    // when player touches coin",
                "  }",
                "",
                "  update(deltaTime: number): void {",
                "    // Scene update logic",
                "  }",
                "",
                "  cleanup(): void {",
                "    this.entities.clear();",
                "  }",
                "}"));
    }

    /**
     * Verifies the scene loader and the registries listing every declaration in source order.
     */
    @Test
    @Tag("unit")
    void testLoaderAndRegistries() {
        // Arrange
        Program program = parse(
                "entity Player { }",
                "behavior Jump { }",
                "entity Coin { }",
                "scene Main { }");

        // Act
        String code = generator.generate(program, OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "export function initializeGame(engine: GameEngine): void {",
                "}",
                "",
                "// Helper function to load scenes",
                "export function loadScene(engine: GameEngine, sceneName: string): void {",
                "  const SceneClass = SceneRegistry[sceneName];",
                "  if (SceneClass) {",
                "    const scene = new SceneClass(engine);",
                "    scene.initialize();",
                "  } else {",
                "    console.error(`Scene ${sceneName} not found`);",
                "  }",
                "}",
                "",
                "export const EntityRegistry: Record<string, any> = {",
                "  Player: Player,",
                "  Coin: Coin,",
                "};",
                "",
                "export const BehaviorRegistry: Record<string, any> = {",
                "  Jump: JumpBehavior,",
                "};",
                "",
                "export const SceneRegistry: Record<string, any> = {",
                "  Main: MainScene,",
                "};"));
        assertThat(code).endsWith("};\n");
    }

    /**
     * Verifies that only the first game declaration is emitted.
     */
    @Test
    @Tag("unit")
    void testOnlyFirstGameIsEmitted() {
        // Act
        String code = generator.generate(parse("game { title: \"a\" }", "game { title: \"b\" }"), OPTIONS).code();

        // Assert
        assertThat(code).containsOnlyOnce("export const gameConfig");
        assertThat(code).doesNotContain("\"b\"");
    }

    /**
     * Verifies the debug annotations and that each source mapping points at the first line
     * of the declaration's block.
     */
    @Test
    @Tag("unit")
    void testDebugCommentsAndSourceMap() {
        // Arrange
        CompilerOptions options = OPTIONS.withDebug(true).withSourceMap(true);
        Program program = parse("game { title: \"x\" }", "", "entity Player { }");

        // Act
        GeneratedCode generated = generator.generate(program, options);

        // Assert
        List<String> lines = generated.code().lines().toList();
        assertThat(lines.subList(0, 3)).containsExactly(
                "// Generated by the GDL compiler (debug build)", "// Declarations: 2", "");
        assertThat(generated.sourceMap())
                .extracting(SourceMapping::declaration, SourceMapping::source)
                .containsExactly(
                        tuple("game", new SourcePosition(1, 1, 0)),
                        tuple("entity Player", new SourcePosition(3, 1, 21)));
        SourceMapping entity = generated.sourceMap().get(1);
        assertThat(lines.get(entity.generatedLine() - 1)).isEqualTo("// Entity: Player");
        assertThat(lines.get(entity.generatedLine() - 2)).isEqualTo("// entity declared at 3:1");
        assertThat(lines.get(generated.sourceMap().get(0).generatedLine() - 1)).isEqualTo("// Game Configuration");
    }

    /**
     * Verifies that no source map is returned unless requested and that output is deterministic.
     */
    @Test
    @Tag("unit")
    void testDeterministicOutputWithoutSourceMap() {
        // Arrange
        Program program = parse("entity A { behaviors: [B] }", "behavior B { update: true }", "scene S { spawn A at [1, 2] }");

        // Act
        GeneratedCode first = generator.generate(program, OPTIONS);
        GeneratedCode second = generator.generate(program, OPTIONS);

        // Assert
        assertThat(first.sourceMap()).isEmpty();
        assertThat(first.code()).isEqualTo(second.code());
        assertThat(first.code()).doesNotContain("declared at");
    }

    /**
     * Verifies that line breaks in a trigger cannot end the generated comment early.
     */
    @Test
    @Tag("unit")
    void testTriggerWithLineBreakStaysInComment() {
        // Act
        String code = generator.generate(parse("scene S { when \"a\\nb()\": { } }"), OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "  private handleEvent1(): void {",
                "    // when a b()",
                "  }"));
        assertThat(code).contains("this.engine.onEvent(\"a\\nb()\", () => this.handleEvent1());");
        assertThat(code.lines()).noneMatch(line -> line.trim().equals("b()"));
    }

    /**
     * Verifies that behavior fields and methods with names that are not identifiers are quoted.
     */
    @Test
    @Tag("unit")
    void testBehaviorMemberNamesAreQuoted() {
        // Act
        String code = generator.generate(
                parse("behavior B { properties: { \"max speed\": 5 }, methods: { \"do it\": true } }"), OPTIONS).code();

        // Assert
        assertThat(code).contains(lines(
                "  \"max speed\": number = 5;",
                "",
                "  \"do it\"(): void {"));
    }

    /**
     * Verifies that the runtime module root is escaped inside the import paths.
     */
    @Test
    @Tag("unit")
    void testRuntimeModuleRootIsEscaped() {
        // Arrange
        CompilerOptions options = new CompilerOptions(false, false, false, "./run\"time\\x", List.of());

        // Act
        String code = generator.generate(parse("entity A { }"), options).code();

        // Assert
        assertThat(code).startsWith("import { GameEngine } from \"./run\\\"time\\\\x/GameEngine\";\n");
    }
}
