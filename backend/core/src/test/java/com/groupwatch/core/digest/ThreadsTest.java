package com.groupwatch.core.digest;

import com.groupwatch.core.model.MailItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadsTest {
    @Test
    void replyJoinsTaggedThreadAndDuplicateUrlIsRejected() {
        Threads threads = new Threads();

        assertTrue(threads.append(MailItem.of("[Dev] Build broke", "alice", "http://list/msg/1")));
        assertTrue(threads.append(MailItem.of("Re: Build broke", "bob", "http://list/msg/2")));
        assertFalse(threads.append(MailItem.of("[Dev] Build broke", "mallory", "http://list/msg/1")));

        assertEquals(1, threads.countThreads());
        assertEquals(2, threads.countMails());
        assertEquals("alice", threads.mails("Build broke").get(0).author());
    }

    @Test
    void differentRawSubjectsWithSameSanitizedSubjectShareAThread() {
        Threads threads = new Threads();
        threads.append(MailItem.of("[Dev] Release plan", "alice", "http://list/msg/1"));
        threads.append(MailItem.of("[Users] Release plan", "bob", "http://list/msg/2"));
        threads.append(MailItem.of("Release plan", "carol", "http://list/msg/3"));
        threads.append(MailItem.of("[Dev] Another topic", "dave", "http://list/msg/4"));

        assertEquals(2, threads.countThreads());
        assertEquals(4, threads.countMails());
        assertEquals(List.of("Release plan", "Another topic"), threads.subjects());
        assertEquals(3, threads.mails("Release plan").size());
    }

    @Test
    void sameUrlUnderDifferentSubjectsIsKeptInBoth() {
        Threads threads = new Threads();

        assertTrue(threads.append(MailItem.of("[Dev] One", "alice", "http://list/msg/1")));
        assertTrue(threads.append(MailItem.of("[Dev] Two", "alice", "http://list/msg/1")));

        assertEquals(2, threads.countThreads());
        assertEquals(2, threads.countMails());
    }

    @Test
    void repeatedAppendsNeverGrowBeyondDistinctUrls() {
        Threads threads = new Threads();
        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < 5; i++) {
                threads.append(MailItem.of("[Dev] Topic " + (i % 2), "author" + round, "http://list/msg/" + i));
            }
        }

        assertEquals(2, threads.countThreads());
        assertEquals(5, threads.countMails());
        assertEquals(5, threads.size());
    }

    @Test
    void emptyCollectionReportsZeroCounts() {
        Threads threads = new Threads("dev");

        assertTrue(threads.isEmpty());
        assertEquals(0, threads.countThreads());
        assertEquals(0, threads.countMails());
        assertEquals("", threads.renderText());
        assertEquals("", threads.renderHtml());
        assertEquals("dev", threads.title());
        assertTrue(threads.mails("missing").isEmpty());
    }

    @Test
    void summaryCountsMailsAndThreads() {
        Threads threads = new Threads();
        threads.append(MailItem.of("[Dev] A", "alice", "http://list/msg/1"));
        assertEquals("1 new mail in 1 thread", threads.summary());

        threads.append(MailItem.of("[Dev] B", "bob", "http://list/msg/2"));
        threads.append(MailItem.of("[Dev] B", "carol", "http://list/msg/3"));
        assertEquals("3 new mails in 2 threads", threads.summary());
    }
}
