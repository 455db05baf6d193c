package com.prakash.stresscoach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration class for scheduler defaults and request limits.
 * <p>
 * This class is bound to the property prefix <strong>stresscoach.scheduler</strong>.
 * </p>
 *
 * Example configuration in <code>application.properties</code>:
 * <pre>
 * stresscoach.scheduler.default-duration-minutes=60
 * stresscoach.scheduler.zone-id=Asia/Colombo
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "stresscoach.scheduler")
public class SchedulerProperties {

    /**
     * Duration given to tasks that arrive without an estimate.
     */
    private int defaultDurationMinutes = 60;

    /**
     * Category given to tasks that arrive without one.
     */
    private String defaultCategory = "work";

    /**
     * Mood assumed when the caller sends none.
     */
    private String defaultMood = "focused";

    /**
     * Largest task list accepted in one request.
     */
    private int maxTasks = 100;

    /**
     * Largest window list accepted in one request.
     */
    private int maxWindows = 50;

    /**
     * Longest task estimate accepted, in minutes. One week by default.
     */
    private int maxTaskMinutes = 10_080;

    /**
     * Longest time window accepted, in minutes. One week by default.
     */
    private int maxWindowMinutes = 10_080;

    /**
     * Zone for "now" and for timestamps without an offset. Blank means the system zone.
     */
    private String zoneId;

    /**
     * Returns the duration used for tasks without an estimate.
     *
     * @return the default duration in minutes
     */
    public int getDefaultDurationMinutes() {
        return defaultDurationMinutes;
    }

    /**
     * Sets the duration used for tasks without an estimate.
     *
     * @param defaultDurationMinutes the default duration in minutes
     */
    public void setDefaultDurationMinutes(int defaultDurationMinutes) {
        this.defaultDurationMinutes = defaultDurationMinutes;
    }

    /**
     * Returns the category used for tasks without one.
     *
     * @return the default category
     */
    public String getDefaultCategory() {
        return defaultCategory;
    }

    /**
     * Sets the category used for tasks without one.
     *
     * @param defaultCategory the default category
     */
    public void setDefaultCategory(String defaultCategory) {
        this.defaultCategory = defaultCategory;
    }

    /**
     * Returns the mood assumed when a request has none.
     *
     * @return the default mood tag
     */
    public String getDefaultMood() {
        return defaultMood;
    }

    /**
     * Sets the mood assumed when a request has none.
     *
     * @param defaultMood the default mood tag
     */
    public void setDefaultMood(String defaultMood) {
        this.defaultMood = defaultMood;
    }

    /**
     * Returns the largest number of tasks accepted in one request.
     *
     * @return the task limit
     */
    public int getMaxTasks() {
        return maxTasks;
    }

    /**
     * Sets the largest number of tasks accepted in one request.
     *
     * @param maxTasks the task limit
     */
    public void setMaxTasks(int maxTasks) {
        this.maxTasks = maxTasks;
    }

    /**
     * Returns the largest number of time windows accepted in one request.
     *
     * @return the window limit
     */
    public int getMaxWindows() {
        return maxWindows;
    }

    /**
     * Sets the largest number of time windows accepted in one request.
     *
     * @param maxWindows the window limit
     */
    public void setMaxWindows(int maxWindows) {
        this.maxWindows = maxWindows;
    }

    /**
     * Returns the longest task estimate accepted.
     *
     * @return the limit in minutes
     */
    public int getMaxTaskMinutes() {
        return maxTaskMinutes;
    }

    /**
     * Sets the longest task estimate accepted.
     *
     * @param maxTaskMinutes the limit in minutes
     */
    public void setMaxTaskMinutes(int maxTaskMinutes) {
        this.maxTaskMinutes = maxTaskMinutes;
    }

    /**
     * Returns the longest time window accepted.
     *
     * @return the limit in minutes
     */
    public int getMaxWindowMinutes() {
        return maxWindowMinutes;
    }

    /**
     * Sets the longest time window accepted.
     *
     * @param maxWindowMinutes the limit in minutes
     */
    public void setMaxWindowMinutes(int maxWindowMinutes) {
        this.maxWindowMinutes = maxWindowMinutes;
    }

    /**
     * Returns the configured zone id for the scheduler clock.
     *
     * @return the zone id, or {@code null}/blank for the system zone
     */
    public String getZoneId() {
        return zoneId;
    }

    /**
     * Sets the zone id for the scheduler clock from application properties.
     *
     * @param zoneId a zone id such as {@code Europe/Berlin}
     */
    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }
}
