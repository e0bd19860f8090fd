package com.example.feed_engine.service;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.ClipStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.feed_engine.support.TestClips.clip;
import static org.assertj.core.api.Assertions.assertThat;

class ClipThreadsTest {

    private final ClipThreads threads = new ClipThreads();

    @Test
    void foldsRepliesAndRemixesIntoCounts() {
        Clip parent = clip("parent").hoursAgo(5).build();
        Clip reply = clip("reply").replyTo("parent").hoursAgo(1).build();
        Clip processingReply = clip("reply-2").replyTo("parent").status(ClipStatus.PROCESSING).build();
        Clip hiddenReply = clip("reply-3").replyTo("parent").status(ClipStatus.HIDDEN).build();
        Clip remix = clip("remix").remixOf("parent").hoursAgo(2).build();
        Clip fresh = clip("fresh").build();

        List<Clip> top = threads.topLevel(List.of(parent, reply, processingReply, hiddenReply, remix, fresh));

        assertThat(top).extracting(Clip::id).containsExactly("fresh", "remix", "parent");
        Clip folded = top.get(2);
        assertThat(folded.replyCount()).isEqualTo(2);
        assertThat(folded.remixCount()).isEqualTo(1);
    }

    @Test
    void dropsUnpublishedClips() {
        List<Clip> top = threads.topLevel(List.of(
                clip("draft").status(ClipStatus.DRAFT).build(),
                clip("removed").status(ClipStatus.REMOVED).build(),
                clip("live").build()));

        assertThat(top).extracting(Clip::id).containsExactly("live");
        assertThat(threads.topLevel(null)).isEmpty();
    }
}
