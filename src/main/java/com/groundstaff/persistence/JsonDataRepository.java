package com.groundstaff.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.groundstaff.domain.Bay;
import com.groundstaff.domain.CertificationRequirement;
import com.groundstaff.domain.Flight;
import com.groundstaff.domain.FlightService;
import com.groundstaff.domain.OperationalDay;
import com.groundstaff.domain.RelativeTime;
import com.groundstaff.domain.Service;
import com.groundstaff.domain.ServiceType;
import com.groundstaff.domain.Shift;
import com.groundstaff.domain.Staff;
import com.groundstaff.engine.DisruptionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads an operational day and its disruption events from JSON files in a directory:
 * services.json, flights.json, roster.json, bays.json and the optional disruptions.json.
 * Clock times are "HH:mm" on the operating date; an end earlier than its start rolls over midnight.
 */
public class JsonDataRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonDataRepository.class);

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("H:mm");

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public JsonDataRepository(Path dataDir) {
        this.dataDir = dataDir;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Load all reference data of one day.
     */
    public OperationalDay loadDay(LocalDate date) throws IOException {
        log.info("Loading data from {} for {}", dataDir, date);

        List<Service> services = new ArrayList<>();
        for (JsonNode node : read("services.json")) {
            services.add(toService(node));
        }
        log.info("Loaded {} services", services.size());

        List<Flight> flights = new ArrayList<>();
        for (JsonNode node : read("flights.json")) {
            flights.add(toFlight(node, date));
        }
        log.info("Loaded {} flights", flights.size());

        List<Staff> roster = new ArrayList<>();
        for (JsonNode node : read("roster.json")) {
            roster.add(toStaff(node, date));
        }
        log.info("Loaded {} staff members", roster.size());

        List<Bay> bays = new ArrayList<>();
        if (Files.exists(dataDir.resolve("bays.json"))) {
            for (JsonNode node : read("bays.json")) {
                bays.add(toBay(node));
            }
        }
        log.info("Loaded {} bays", bays.size());

        return new OperationalDay(date, services, flights, roster, bays);
    }

    /**
     * Disruption events in file order, or an empty list when there is no disruptions.json.
     */
    public List<DisruptionEvent> loadDisruptions(LocalDate date) throws IOException {
        if (!Files.exists(dataDir.resolve("disruptions.json"))) {
            return List.of();
        }
        List<DisruptionEvent> events = new ArrayList<>();
        for (JsonNode node : read("disruptions.json")) {
            DisruptionEvent.Builder b = DisruptionEvent.at(date.atTime(clock(required(node, "current_time"))));
            if (node.has("description")) {
                b.description(node.get("description").asText());
            }
            b.invalidFlights(texts(node, "invalid_flights"));
            b.invalidServices(texts(node, "invalid_services"));
            b.invalidStaff(texts(node, "invalid_staff"));
            for (JsonNode f : node.path("rescheduled_flights")) {
                b.rescheduled(toFlight(f, date));
            }
            for (JsonNode s : node.path("added_staff")) {
                b.addStaff(toStaff(s, date));
            }
            events.add(b.build());
        }
        log.info("Loaded {} disruption events", events.size());
        return events;
    }

    // ========== Mapping ==========

    Service toService(JsonNode node) {
        List<String> certifications = new ArrayList<>(List.of(texts(node, "certifications")));
        Set<String> excluded = new HashSet<>(List.of(texts(node, "exclude_services")));
        CertificationRequirement requirement = node.has("certification_requirement")
                ? CertificationRequirement.fromName(node.get("certification_requirement").asText())
                : CertificationRequirement.ALL;
        return new Service(
                required(node, "id"),
                node.has("name") ? node.get("name").asText() : null,
                ServiceType.fromCode(required(node, "type")),
                certifications,
                requirement,
                node.path("cross_utilization_limit").asInt(0),
                excluded);
    }

    Flight toFlight(JsonNode node, LocalDate date) {
        LocalDateTime arrival = date.atTime(clock(required(node, "arrival")));
        LocalDateTime departure = date.atTime(clock(required(node, "departure")));
        if (departure.isBefore(arrival)) {
            departure = departure.plusDays(1);
        }
        List<FlightService> services = new ArrayList<>();
        for (JsonNode fs : node.path("flight_services")) {
            services.add(new FlightService(
                    required(fs, "id"),
                    fs.path("count").asInt(1),
                    RelativeTime.parse(required(fs, "start")),
                    RelativeTime.parse(required(fs, "end"))));
        }
        String bay = node.hasNonNull("bay_number") ? node.get("bay_number").asText() : null;
        return new Flight(required(node, "number"), arrival, departure, bay, services);
    }

    Staff toStaff(JsonNode node, LocalDate date) {
        List<Shift> shifts = new ArrayList<>();
        for (JsonNode shift : node.path("shifts")) {
            LocalDateTime start = date.atTime(clock(required(shift, "start")));
            LocalDateTime end = date.atTime(clock(required(shift, "end")));
            if (end.isBefore(start)) {
                end = end.plusDays(1);
            }
            shifts.add(new Shift(start, end));
        }
        return new Staff(required(node, "id"), node.has("name") ? node.get("name").asText() : null,
                new HashSet<>(List.of(texts(node, "certifications"))), shifts);
    }

    Bay toBay(JsonNode node) {
        Map<String, Integer> travel = new LinkedHashMap<>();
        node.path("travel_time").fields().forEachRemaining(e -> travel.put(e.getKey(), e.getValue().asInt()));
        return new Bay(required(node, "number"), travel);
    }

    private JsonNode read(String fileName) throws IOException {
        Path file = dataDir.resolve(fileName);
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException(file + " must contain a JSON array");
        }
        return root;
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "' in " + node);
        }
        return value.asText();
    }

    private static String[] texts(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode v : node.path(field)) {
            values.add(v.asText());
        }
        return values.toArray(new String[0]);
    }

    private static LocalTime clock(String text) {
        try {
            return LocalTime.parse(text.trim(), CLOCK);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time '" + text + "', expected HH:mm", e);
        }
    }
}
