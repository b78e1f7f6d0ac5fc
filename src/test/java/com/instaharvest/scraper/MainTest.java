package com.instaharvest.scraper;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.instaharvest.scraper.FakeAutomationDriver.FakeElement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MainTest {
    @TempDir
    Path artifacts;

    @Test
    void testListSelectionDefaultsToBoth() {
        assertThat(Main.listSelection(new String[] {"target"})).isEqualTo("both");
        assertThat(Main.listSelection(new String[] {"target", " "})).isEqualTo("both");
    }

    @Test
    void testListSelectionIsCaseInsensitive() {
        assertThat(Main.listSelection(new String[] {"target", " Followers "})).isEqualTo("followers");
        assertThat(Main.listSelection(new String[] {"target", "FOLLOWING"})).isEqualTo("following");
    }

    @Test
    void testUnknownListSelectionRejected() {
        assertThatThrownBy(() -> Main.listSelection(new String[] {"target", "folowers"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("folowers");
    }

    @Test
    void testUnknownListSelectionExitsWithUsageBeforeSignIn() {
        assertThat(Main.execute(new String[] {"target", "everything"})).isEqualTo(2);
    }

    @Test
    void testRunPrintsOnlySelectedList() {
        FakeClock clock = new FakeClock();
        FakeAutomationDriver driver = new FakeAutomationDriver(clock);
        SelectorConfiguration selectors = SelectorConfiguration.loadDefault();
        driver.on(selectors.get(SelectorKey.LOGIN_USERNAME_INPUT), new FakeElement("username", ""));
        driver.on(selectors.get(SelectorKey.LOGIN_PASSWORD_INPUT), new FakeElement("password", ""));
        driver.onEnter = () -> driver.currentUrl = "https://www.instagram.com/";
        String link = selectors.get(ListKind.FOLLOWING.entryPoint());
        String rows = selectors.get(SelectorKey.PROFILE_USERNAME_SPAN);
        driver.on(link, new FakeElement(link, "2 following"));
        driver.on(rows, () -> List.of(new FakeElement(rows, "ana"), new FakeElement(rows, "bruno")));
        SessionOptions options = SessionOptions.builder()
            .selectors(selectors)
            .artifactsDir(artifacts)
            .driverFactory(opts -> driver)
            .build();

        try (HarvestSession session = HarvestSession.open(new Credentials("harvest.bot", "s3cr3t!"), options, clock)) {
            ObjectNode output = Main.run(session, "target", "following", null);

            assertThat(output.has("followers")).isFalse();
            assertThat(output.get("profile").asText()).isEqualTo("target");
            assertThat(output.get("following").get("collected").asInt()).isEqualTo(2);
            assertThat(output.get("following").get("stopReason").asText()).isEqualTo("EXPECTED_COUNT_REACHED");
            assertThat(output.get("following").get("handles").size()).isEqualTo(2);
        }
    }

    @Test
    void testRunRejectsUnknownSelectionBeforeExtracting() {
        assertThatThrownBy(() -> Main.run(null, "target", "all", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
