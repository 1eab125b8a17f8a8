package com.servicedesk.automation.service;

import com.servicedesk.automation.config.RoutingConfig;
import com.servicedesk.automation.engine.SlaCalculator;
import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.PagedResponse;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.SlaState;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketDetail;
import com.servicedesk.automation.model.TicketStats;
import com.servicedesk.automation.model.TicketStatus;
import com.servicedesk.automation.repository.TicketStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side: filtering, search, paging and aggregates. Never writes.
 */
@Service
public class TicketQueryService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final TicketStore store;
    private final SlaCalculator slaCalculator;
    private final RoutingConfig routingConfig;
    private final TicketLifecycleService lifecycleService;

    public TicketQueryService(TicketStore store,
                              SlaCalculator slaCalculator,
                              RoutingConfig routingConfig,
                              TicketLifecycleService lifecycleService) {
        this.store = store;
        this.slaCalculator = slaCalculator;
        this.routingConfig = routingConfig;
        this.lifecycleService = lifecycleService;
    }

    /**
     * Newest first. {@code before} is the id cursor from the previous page; any filter
     * left null matches everything. {@code query} is a case-insensitive substring match
     * on subject, body and sender.
     */
    public PagedResponse<Ticket> search(TicketStatus status, Priority priority, Category category,
                                        SlaState slaState, String query,
                                        Integer limit, Long before, Instant now) {
        int pageSize = clampLimit(limit);
        String needle = query != null && !query.isBlank() ? query.strip().toLowerCase(Locale.ROOT) : null;

        List<Ticket> source = status != null ? store.listByStatus(status) : store.findAll();
        List<Ticket> matches = new ArrayList<>();
        for (Ticket t : source) {
            if (before != null && t.getId() >= before) continue;
            if (priority != null && t.getPriority() != priority) continue;
            if (category != null && t.getCategory() != category) continue;
            if (needle != null && !contains(t, needle)) continue;
            if (slaState != null && slaCalculator.state(t, now) != slaState) continue;
            matches.add(t);
        }

        matches.sort(Comparator.comparingLong(Ticket::getId).reversed());
        boolean hasMore = matches.size() > pageSize;
        List<Ticket> page = hasMore ? new ArrayList<>(matches.subList(0, pageSize)) : matches;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getId()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    public TicketDetail detail(long ticketId, Instant now) {
        Ticket ticket = lifecycleService.getTicket(ticketId);
        return TicketDetail.builder()
                .ticket(ticket)
                .sla(slaCalculator.status(ticket, now))
                .build();
    }

    public TicketStats stats() {
        List<Ticket> tickets = store.findAll();
        return TicketStats.builder()
                .total(tickets.size())
                .open((int) tickets.stream().filter(t -> !t.isTerminal()).count())
                .byStatus(countBy(tickets, Ticket::getStatus, TicketStatus.class))
                .byPriority(countBy(tickets, Ticket::getPriority, Priority.class))
                .byCategory(countBy(tickets, Ticket::getCategory, Category.class))
                .build();
    }

    /**
     * Open tickets per team mailbox. Every configured team is listed, idle ones with zero.
     */
    public Map<String, Integer> workload() {
        Map<String, Integer> workload = new TreeMap<>();
        for (String team : routingConfig.getTeams().values()) {
            workload.put(team, 0);
        }
        workload.put(routingConfig.getDefaultTeam(), 0);

        for (Ticket t : store.findAll()) {
            if (t.isTerminal() || t.getAssignedTeam() == null) continue;
            workload.merge(t.getAssignedTeam(), 1, Integer::sum);
        }
        return workload;
    }

    private static boolean contains(Ticket t, String needle) {
        return containsIgnoreCase(t.getSubject(), needle)
                || containsIgnoreCase(t.getBody(), needle)
                || containsIgnoreCase(t.getSender(), needle);
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static int clampLimit(Integer limit) {
        if (limit == null || limit <= 0) return DEFAULT_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }

    private static <E extends Enum<E>> Map<E, Long> countBy(List<Ticket> tickets,
                                                             Function<Ticket, E> key,
                                                             Class<E> type) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (E value : type.getEnumConstants()) {
            counts.put(value, 0L);
        }
        counts.putAll(tickets.stream()
                .filter(t -> key.apply(t) != null)
                .collect(Collectors.groupingBy(key, Collectors.counting())));
        return counts;
    }
}
