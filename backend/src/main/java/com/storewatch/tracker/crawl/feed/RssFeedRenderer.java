package com.storewatch.tracker.crawl.feed;

import com.storewatch.tracker.crawl.model.FeedEvent;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Component
public class RssFeedRenderer implements FeedRenderer {
    private static final DateTimeFormatter RFC_1123 = DateTimeFormatter.RFC_1123_DATE_TIME.withZone(ZoneOffset.UTC);
    private static final int TTL_MINUTES = 30;

    @Override
    public String render(FeedChannel channel, List<FeedEvent> events, Instant builtAt) {
        Document document = Jsoup.parse("", "", Parser.xmlParser());
        XmlDeclaration declaration = new XmlDeclaration("xml", false);
        declaration.attr("version", "1.0");
        declaration.attr("encoding", "UTF-8");
        document.appendChild(declaration);

        Element rss = document.appendElement("rss").attr("version", "2.0");
        Element channelElement = rss.appendElement("channel");
        channelElement.appendElement("title").text(channel.title());
        channelElement.appendElement("link").text(channel.link());
        channelElement.appendElement("description").text(channel.description());
        channelElement.appendElement("language").text("en-us");
        channelElement.appendElement("ttl").text(String.valueOf(TTL_MINUTES));
        channelElement.appendElement("lastBuildDate").text(RFC_1123.format(builtAt));

        for (FeedEvent event : events) {
            Element item = channelElement.appendElement("item");
            item.appendElement("title").text(event.title());
            if (event.link() != null) {
                item.appendElement("link").text(event.link());
            }
            item.appendElement("guid").attr("isPermaLink", "false").text(event.identityKey());
            Instant published = event.timestamp() == null ? builtAt : event.timestamp();
            item.appendElement("pubDate").text(RFC_1123.format(published));
            String description = description(event);
            if (!description.isEmpty()) {
                item.appendElement("description").text(description);
            }
        }
        return document.outerHtml();
    }

    private static String description(FeedEvent event) {
        StringBuilder out = new StringBuilder();
        if (event.summary() != null && !event.summary().isBlank()) {
            out.append(event.summary());
        }
        if (event.imageUrl() != null) {
            if (out.length() > 0) {
                out.append("<br/>");
            }
            out.append("<img src=\"").append(event.imageUrl()).append("\" referrerpolicy=\"no-referrer\" />");
        }
        return out.toString();
    }
}
