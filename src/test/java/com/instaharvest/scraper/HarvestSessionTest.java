package com.instaharvest.scraper;

import com.instaharvest.scraper.FakeAutomationDriver.FakeElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HarvestSessionTest {
    private static final Credentials CREDENTIALS = new Credentials("harvest.bot", "s3cr3t!");

    @TempDir
    Path artifacts;

    private final SelectorConfiguration selectors = SelectorConfiguration.loadDefault();
    private FakeClock clock;
    private FakeAutomationDriver driver;
    private int factoryCalls;

    @BeforeEach
    void setUp() {
        clock = new FakeClock();
        driver = new FakeAutomationDriver(clock);
        driver.on(selectors.get(SelectorKey.LOGIN_USERNAME_INPUT), new FakeElement("username", ""));
        driver.on(selectors.get(SelectorKey.LOGIN_PASSWORD_INPUT), new FakeElement("password", ""));
        driver.onEnter = () -> driver.currentUrl = "https://www.instagram.com/";
    }

    private SessionOptions options() {
        return SessionOptions.builder()
            .selectors(selectors)
            .artifactsDir(artifacts)
            .driverFactory(opts -> {
                factoryCalls++;
                return driver;
            })
            .build();
    }

    private void installList(ListKind kind, String label, String... handles) {
        String link = selectors.get(kind.entryPoint());
        String rows = selectors.get(SelectorKey.PROFILE_USERNAME_SPAN);
        List<UiElement> visible = new ArrayList<>();
        driver.on(link, new FakeElement(link, label).onClick(() -> {
            visible.clear();
            for (String handle : handles) visible.add(new FakeElement(rows, handle));
        }));
        driver.on(rows, () -> visible);
    }

    @Test
    void testOpenAuthenticatesWithOneDriver() {
        try (HarvestSession session = HarvestSession.open(CREDENTIALS, options(), clock)) {
            assertThat(session.state()).isEqualTo(SessionState.AUTHENTICATED);
            assertThat(factoryCalls).isEqualTo(1);
        }
        assertThat(driver.closeCount).isEqualTo(1);
    }

    @Test
    void testGetFollowersAndFollowing() {
        installList(ListKind.FOLLOWERS, "3 followers", "ana", "bruno", "carla");
        HarvestSession session = HarvestSession.open(CREDENTIALS, options(), clock);

        assertThat(session.getFollowers("target")).containsExactly("ana", "bruno", "carla");

        installList(ListKind.FOLLOWING, "1 following", "dani");
        assertThat(session.getFollowing("target", Duration.ofSeconds(30))).containsExactly("dani");
        assertThat(session.getTotalCount("target", ListKind.FOLLOWERS)).isEqualTo(3);
        session.close();
    }

    @Test
    void testUnavailableListIsEmptyNotAnError() {
        HarvestSession session = HarvestSession.open(CREDENTIALS, options(), clock);

        assertThat(session.getFollowers("ghost_profile")).isEmpty();
        assertThat(session.state()).isEqualTo(SessionState.AUTHENTICATED);
        session.close();
    }

    @Test
    void testCloseIsIdempotent() {
        HarvestSession session = HarvestSession.open(CREDENTIALS, options(), clock);

        session.close();
        session.close();

        assertThat(driver.closeCount).isEqualTo(1);
        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
    }

    @Test
    void testClosedSessionRejectsOperations() {
        HarvestSession session = HarvestSession.open(CREDENTIALS, options(), clock);
        session.close();

        assertThatThrownBy(() -> session.getFollowers("target")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.getTotalCount("target", ListKind.FOLLOWING)).isInstanceOf(IllegalStateException.class);
        assertThat(driver.navigations).hasSize(1);
    }

    @Test
    void testDriverInitFailure() {
        SessionOptions options = options().toBuilder()
            .driverFactory(opts -> {
                throw new DriverException("Executable doesn't exist");
            })
            .build();

        assertThatThrownBy(() -> HarvestSession.open(CREDENTIALS, options, clock))
            .isInstanceOfSatisfying(LoginException.class,
                e -> assertThat(e.failure()).isEqualTo(LoginFailure.DRIVER_INIT_FAILED));
    }

    @Test
    void testLoginFailureReleasesDriver() {
        driver.failingUrls.add(options().loginUrl());

        assertThatThrownBy(() -> HarvestSession.open(CREDENTIALS, options(), clock))
            .isInstanceOfSatisfying(LoginException.class,
                e -> assertThat(e.failure()).isEqualTo(LoginFailure.NAVIGATION_FAILED));
        assertThat(driver.closeCount).isEqualTo(1);
    }

    @Test
    void testTunablesApplyToNextExtraction() {
        HarvestSession session = HarvestSession.open(CREDENTIALS, options(), clock);

        session.setMaxRefreshAttempts(10);
        session.setWaitInterval(Duration.ofMillis(200));
        session.setAdditionalScrollAttempts(3);
        session.setPauseTime(Duration.ofSeconds(1));
        session.setMaxAttempts(4);

        ExtractionSettings settings = session.getSettings();
        assertThat(settings.maxRefreshAttempts()).isEqualTo(10);
        assertThat(settings.waitInterval()).isEqualTo(Duration.ofMillis(200));
        assertThat(settings.additionalScrollAttempts()).isEqualTo(3);
        assertThat(settings.pauseTime()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.maxAttempts()).isEqualTo(4);
        assertThatThrownBy(() -> session.setMaxAttempts(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(session.getSettings().maxAttempts()).isEqualTo(4);
        session.close();
    }

    @Test
    void testExtractWithPerCallSettingsLeavesSessionSettings() {
        installList(ListKind.FOLLOWERS, "followers", "ana");
        HarvestSession session = HarvestSession.open(CREDENTIALS, options(), clock);

        ExtractionResult result = session.extract(ExtractionRequest.of("target", ListKind.FOLLOWERS),
            ExtractionSettings.defaults().withMaxRefreshAttempts(0));

        assertThat(result.stopReason()).isEqualTo(StopReason.CONVERGED);
        assertThat(result.refreshes()).isZero();
        assertThat(session.getSettings()).isEqualTo(ExtractionSettings.defaults());
        session.close();
    }
}
