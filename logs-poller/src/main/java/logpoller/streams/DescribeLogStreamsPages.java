/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package logpoller.streams;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogStreamsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.LogStream;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Iterates through log streams whose names start with a prefix, requesting each page from CloudWatch only when the
 * previous page has been consumed. Ends when CloudWatch returns a page with no next token. Can only be iterated once.
 */
class DescribeLogStreamsPages implements Iterator<LogStream> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DescribeLogStreamsPages.class);

    private final CloudWatchLogsClient cloudWatch;
    private final String logGroupName;
    private final String logStreamNamePrefix;
    private Iterator<LogStream> currentPage = Collections.emptyIterator();
    private String nextToken;
    private boolean lastPageRequested;
    private int pagesRequested;

    private DescribeLogStreamsPages(CloudWatchLogsClient cloudWatch, String logGroupName, String logStreamNamePrefix) {
        this.cloudWatch = cloudWatch;
        this.logGroupName = logGroupName;
        this.logStreamNamePrefix = logStreamNamePrefix;
    }

    /**
     * Streams all log streams in a log group whose names start with a prefix.
     *
     * @param  cloudWatch          the CloudWatch Logs client
     * @param  logGroupName        the log group name
     * @param  logStreamNamePrefix the log stream name prefix
     * @return                     the log streams, in the order CloudWatch returned them
     */
    static Stream<LogStream> stream(CloudWatchLogsClient cloudWatch, String logGroupName, String logStreamNamePrefix) {
        DescribeLogStreamsPages pages = new DescribeLogStreamsPages(cloudWatch, logGroupName, logStreamNamePrefix);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED), false);
    }

    @Override
    public boolean hasNext() {
        while (!currentPage.hasNext() && !lastPageRequested) {
            requestNextPage();
        }
        return currentPage.hasNext();
    }

    @Override
    public LogStream next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return currentPage.next();
    }

    private void requestNextPage() {
        DescribeLogStreamsResponse response = cloudWatch.describeLogStreams(builder -> builder
                .logGroupName(logGroupName)
                .logStreamNamePrefix(logStreamNamePrefix)
                .nextToken(nextToken));
        pagesRequested++;
        LOGGER.trace("Found {} log streams with prefix {} in page {}",
                response.logStreams().size(), logStreamNamePrefix, pagesRequested);
        currentPage = response.logStreams().iterator();
        nextToken = response.nextToken();
        lastPageRequested = nextToken == null || nextToken.isEmpty();
    }
}
