package com.aiadvent.mcp.context.graph;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class ImportResolverTest {

  private static final Set<String> KNOWN =
      Set.of(
          "/src/App.tsx",
          "/src/components/Player.tsx",
          "/src/components/ui/index.ts",
          "/src/hooks/useGame.ts",
          "/src/lib/utils.ts",
          "/src/types/game.ts");

  @Test
  void resolvesAliasWithInferredExtension() {
    assertThat(ImportResolver.resolve("/src/App.tsx", "@/hooks/useGame", KNOWN))
        .isEqualTo("/src/hooks/useGame.ts");
  }

  @Test
  void resolvesRelativeSpecifiersAgainstImportingDirectory() {
    assertThat(ImportResolver.resolve("/src/components/Player.tsx", "../types/game", KNOWN))
        .isEqualTo("/src/types/game.ts");
    assertThat(ImportResolver.resolve("/src/App.tsx", "./components/Player", KNOWN))
        .isEqualTo("/src/components/Player.tsx");
  }

  @Test
  void resolvesDirectoryIndexFiles() {
    assertThat(ImportResolver.resolve("/src/App.tsx", "./components/ui", KNOWN))
        .isEqualTo("/src/components/ui/index.ts");
  }

  @Test
  void keepsExplicitExtensionAsIs() {
    assertThat(ImportResolver.resolve("/src/App.tsx", "./index.css", KNOWN))
        .isEqualTo("/src/index.css");
  }

  @Test
  void fallsBackToBaseNameMatch() {
    assertThat(ImportResolver.resolve("/src/pages/Home.tsx", "@/utils", KNOWN))
        .isEqualTo("/src/lib/utils.ts");
    assertThat(ImportResolver.resolve("/src/pages/Home.tsx", "./useGame", KNOWN))
        .isEqualTo("/src/hooks/useGame.ts");
  }

  @Test
  void absoluteSpecifiersAreNotProjectImports() {
    assertThat(ImportResolver.resolve("/src/App.tsx", "/lib/utils", KNOWN)).isNull();
    assertThat(ImportResolver.resolve("/src/App.tsx", "/src/lib/utils.ts", KNOWN)).isNull();
  }

  @Test
  void externalPackagesAndUnknownTargetsResolveToNull() {
    assertThat(ImportResolver.resolve("/src/App.tsx", "react", KNOWN)).isNull();
    assertThat(ImportResolver.resolve("/src/App.tsx", "@/hooks/useMissing", KNOWN)).isNull();
    assertThat(ImportResolver.resolve("/src/App.tsx", "", KNOWN)).isNull();
  }

  @Test
  void resolutionIsDeterministic() {
    String first = ImportResolver.resolve("/src/App.tsx", "@/lib/utils", KNOWN);
    String second = ImportResolver.resolve("/src/App.tsx", "@/lib/utils", KNOWN);

    assertThat(first).isEqualTo("/src/lib/utils.ts").isEqualTo(second);
  }
}
