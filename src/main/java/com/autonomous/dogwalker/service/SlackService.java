package com.autonomous.dogwalker.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.reactions.ReactionsAddRequest;
import com.slack.api.methods.request.users.UsersInfoRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import com.slack.api.methods.response.reactions.ReactionsAddResponse;
import com.slack.api.methods.response.users.UsersInfoResponse;
import com.slack.api.model.User;
import com.slack.api.model.block.LayoutBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Stream;

import static com.slack.api.model.block.Blocks.actions;
import static com.slack.api.model.block.Blocks.asBlocks;
import static com.slack.api.model.block.Blocks.section;
import static com.slack.api.model.block.composition.BlockCompositions.markdownText;
import static com.slack.api.model.block.composition.BlockCompositions.plainText;
import static com.slack.api.model.block.element.BlockElements.asElements;
import static com.slack.api.model.block.element.BlockElements.button;

/**
 * Slack Web API side of the chat layer. Failures are logged and reported as
 * a null timestamp; a lost chat message never fails a task.
 */
@Service
public class SlackService implements ChatGateway {

    private static final Logger log = LoggerFactory.getLogger(SlackService.class);

    private static final String UNKNOWN_USER = "Unknown User";

    @Value("${dogwalker.slack.bot-token:}")
    private String slackBotToken;

    private final Slack slack = Slack.getInstance();

    @Override
    public String post(String channelId, String threadTs, String text, String emoji) {
        String body = emoji == null ? text : emoji + " " + text;
        return send(ChatPostMessageRequest.builder()
            .channel(channelId)
            .threadTs(threadTs)
            .text(body)
            .build());
    }

    @Override
    public String postWithButton(String channelId, String threadTs, String text,
                                 String actionId, String buttonLabel, String value) {
        List<LayoutBlock> blocks = asBlocks(
            section(s -> s.text(markdownText(text))),
            actions(a -> a.elements(asElements(
                button(b -> b.actionId(actionId).text(plainText(buttonLabel)).style("danger").value(value))
            )))
        );
        return send(ChatPostMessageRequest.builder()
            .channel(channelId)
            .threadTs(threadTs)
            .text(text)
            .blocks(blocks)
            .build());
    }

    @Override
    public void react(String channelId, String messageTs, String emoji) {
        try {
            ReactionsAddResponse response = methods().reactionsAdd(ReactionsAddRequest.builder()
                .channel(channelId)
                .timestamp(messageTs)
                .name(emoji)
                .build());
            if (!response.isOk()) {
                log.debug("Could not add reaction {}: {}", emoji, response.getError());
            }
        } catch (Exception e) {
            log.debug("Could not add reaction {}: {}", emoji, e.getMessage());
        }
    }

    @Override
    public String displayName(String userId) {
        if (userId == null) {
            return UNKNOWN_USER;
        }
        try {
            UsersInfoResponse response = methods().usersInfo(UsersInfoRequest.builder().user(userId).build());
            if (!response.isOk() || response.getUser() == null) {
                return UNKNOWN_USER;
            }
            User user = response.getUser();
            User.Profile profile = user.getProfile();
            return Stream.of(
                    profile == null ? null : profile.getDisplayNameNormalized(),
                    profile == null ? null : profile.getDisplayName(),
                    profile == null ? null : profile.getRealNameNormalized(),
                    profile == null ? null : profile.getRealName(),
                    user.getName())
                .filter(name -> name != null && !name.isBlank())
                .findFirst()
                .orElse(UNKNOWN_USER);
        } catch (Exception e) {
            log.error("Failed to get user info for {}: {}", userId, e.getMessage());
            return UNKNOWN_USER;
        }
    }

    private String send(ChatPostMessageRequest request) {
        try {
            ChatPostMessageResponse response = methods().chatPostMessage(request);
            if (response.isOk()) {
                return response.getTs();
            }
            log.error("Failed to post message to {}: {}", request.getChannel(), response.getError());
            return null;
        } catch (Exception e) {
            log.error("Failed to post message to {}: {}", request.getChannel(), e.getMessage());
            return null;
        }
    }

    private MethodsClient methods() {
        return slack.methods(slackBotToken);
    }
}
