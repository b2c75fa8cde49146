package com.example.connectionmonitor.service.alert;

import com.example.connectionmonitor.config.SlackProperties;
import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.service.runner.RunSummary;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Posts to Slack when a scheduled run ends failed or error.
 * <p>
 * Delivery problems are logged and never reach the dispatcher.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:connection-monitor}")
    private String applicationName = "connection-monitor";

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert on a failed or errored schedule run.
     * Runs asynchronously so the polling cycle is not held up by Slack.
     */
    @Async
    public void sendScheduleFailureAlert(ConnectionTestSchedule schedule, RunSummary summary) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Schedule {} ended {} but no alert was sent.",
                    schedule.getId(), summary.getStatus());
            return;
        }

        try {
            var payload = buildFailurePayload(schedule, summary);
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for schedule {} ({})", schedule.getId(), summary.getStatus());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for schedule {}: {}", schedule.getId(), e.getMessage(), e);
        }
    }

    Payload buildFailurePayload(ConnectionTestSchedule schedule, RunSummary summary) {
        var scheduleId = schedule.getId().toString();
        var status = summary.getStatus().getDisplayName();

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Scheduled Connection Test " + status + "*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title("Application " + schedule.getApplicationId())
                                .titleLink(buildScheduleLink(scheduleId))
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Schedule ID")
                                                .value(scheduleId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Cron")
                                                .value("`" + schedule.getCronExpression() + "`")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Connections")
                                                .value(String.format("%d tested, %d failed",
                                                        summary.getTotalConnections(), summary.getFailureCount()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Ran At")
                                                .value(DATE_FORMATTER.format(Instant.now()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Result")
                                                .value("```" + truncate(summary.getMessage(), 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String buildScheduleLink(String scheduleId) {
        return slackProperties.getDashboardBaseUrl() + "/schedules/" + scheduleId;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
