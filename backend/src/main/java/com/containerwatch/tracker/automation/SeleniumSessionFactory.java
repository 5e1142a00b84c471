package com.containerwatch.tracker.automation;

import com.containerwatch.tracker.config.TrackerProperties;
import com.containerwatch.tracker.execution.AutomationSession;
import com.containerwatch.tracker.execution.AutomationSessionFactory;
import com.containerwatch.tracker.execution.FailureClassifier;
import com.containerwatch.tracker.execution.TransientTrackingException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SeleniumSessionFactory implements AutomationSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(SeleniumSessionFactory.class);

    private final TrackerProperties.Automation properties;
    private final TrackingPageParser parser;

    public SeleniumSessionFactory(TrackerProperties properties, TrackingPageParser parser) {
        this.properties = properties.getAutomation();
        this.parser = parser;
    }

    @Override
    public AutomationSession open() {
        WebDriver driver;
        try {
            driver = new ChromeDriver(chromeOptions());
        } catch (WebDriverException e) {
            throw new TransientTrackingException(FailureClassifier.BROWSER_START_FAILED, "browser_start_failed", e);
        }
        try {
            driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(properties.getPageLoadTimeoutSeconds()));
        } catch (WebDriverException e) {
            driver.quit();
            throw new TransientTrackingException(FailureClassifier.BROWSER_START_FAILED, "browser_start_failed", e);
        }
        log.debug("Started browser session headless={}", properties.isHeadless());
        return new SeleniumTrackingSession(driver, properties, parser);
    }

    ChromeOptions chromeOptions() {
        ChromeOptions options = new ChromeOptions();
        if (properties.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=1920,1080",
            "--user-agent=" + properties.getUserAgent()
        );
        return options;
    }
}
