package com.containerwatch.tracker.automation;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.execution.AutomationSession;
import com.containerwatch.tracker.execution.CancellationToken;
import com.containerwatch.tracker.execution.FailureClassifier;
import com.containerwatch.tracker.execution.TrackingNotFoundException;
import com.containerwatch.tracker.execution.TransientTrackingException;
import com.containerwatch.tracker.model.TrackingResult;
import org.openqa.selenium.By;
import org.openqa.selenium.Keys;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;

public class SeleniumTrackingSession implements AutomationSession {
    private static final Logger log = LoggerFactory.getLogger(SeleniumTrackingSession.class);
    private static final By COOKIE_ACCEPT = By.xpath("//button[contains(text(), 'Принять')]");
    private static final By TEXT_INPUTS = By.cssSelector("input[type='text']");
    private static final By BODY = By.tagName("body");
    private static final int MIN_RESULT_TEXT_LENGTH = 100;

    private final WebDriver driver;
    private final TrackerProperties.Automation properties;
    private final TrackingPageParser parser;

    public SeleniumTrackingSession(WebDriver driver, TrackerProperties.Automation properties, TrackingPageParser parser) {
        this.driver = driver;
        this.properties = properties;
        this.parser = parser;
    }

    @Override
    public TrackingResult track(String query, CancellationToken token) {
        try {
            token.throwIfCancelled();
            driver.get(properties.getTrackingUrl());
            token.throwIfCancelled();
            dismissCookieBanner();
            token.throwIfCancelled();
            submitQuery(query);
            token.throwIfCancelled();
            waitForResults();
            token.throwIfCancelled();
            return parser.parse(query, driver.getPageSource());
        } catch (TrackingNotFoundException e) {
            screenshot(query, "not_found");
            throw e;
        } catch (TimeoutException e) {
            screenshot(query, "timeout");
            throw new TransientTrackingException(FailureClassifier.PAGE_TIMEOUT, "tracking page did not respond", e);
        } catch (WebDriverException e) {
            screenshot(query, "error");
            throw new TransientTrackingException(FailureClassifier.BROWSER_ERROR, summary(e), e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Browser quit failed: {}", summary(e));
        }
    }

    private void dismissCookieBanner() {
        try {
            WebElement accept = new WebDriverWait(driver, Duration.ofSeconds(5))
                .until(ExpectedConditions.elementToBeClickable(COOKIE_ACCEPT));
            accept.click();
        } catch (TimeoutException e) {
            log.debug("No cookie banner on tracking page");
        }
    }

    private void submitQuery(String query) {
        WebDriverWait wait = new WebDriverWait(driver, Duration.ofSeconds(properties.getElementWaitSeconds()));
        List<WebElement> inputs = wait.until(ExpectedConditions.presenceOfAllElementsLocatedBy(TEXT_INPUTS));
        // the search box is the last text input; earlier ones belong to the site header
        WebElement input = wait.until(ExpectedConditions.elementToBeClickable(inputs.get(inputs.size() - 1)));
        input.clear();
        input.sendKeys(query);
        input.sendKeys(Keys.RETURN);
    }

    private void waitForResults() {
        try {
            new WebDriverWait(driver, Duration.ofSeconds(properties.getElementWaitSeconds()))
                .until(d -> d.findElement(BODY).getText().length() > MIN_RESULT_TEXT_LENGTH);
        } catch (TimeoutException e) {
            log.debug("Result text did not grow within {}s, parsing what is there", properties.getElementWaitSeconds());
        }
    }

    private void screenshot(String query, String reason) {
        if (!properties.isScreenshotsEnabled() || !(driver instanceof TakesScreenshot camera)) {
            return;
        }
        try {
            File shot = camera.getScreenshotAs(OutputType.FILE);
            Path dir = Path.of(properties.getScreenshotDir());
            Files.createDirectories(dir);
            String safeQuery = query.replaceAll("[^A-Za-z0-9_-]", "_");
            Path target = dir.resolve(safeQuery + "_" + reason + "_" + System.currentTimeMillis() + ".png");
            Files.copy(shot.toPath(), target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Saved screenshot {}", target);
        } catch (IOException | WebDriverException e) {
            log.warn("Could not save screenshot for {}: {}", query, e.getMessage());
        }
    }

    private static String summary(WebDriverException e) {
        String message = e.getMessage();
        if (message == null) {
            return e.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
