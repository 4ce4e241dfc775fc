package com.studiomanagement.booking.service;

import com.studiomanagement.booking.constants.BookingConstants;
import com.studiomanagement.booking.constants.ErrorCodes;
import com.studiomanagement.booking.constants.ValidationMessages;
import com.studiomanagement.booking.dto.BookingReport;
import com.studiomanagement.booking.dto.BookingRequest;
import com.studiomanagement.booking.enums.SlotState;
import com.studiomanagement.booking.exception.ClientNotFoundException;
import com.studiomanagement.booking.exception.HallNotAvailableException;
import com.studiomanagement.booking.exception.NoHallsException;
import com.studiomanagement.booking.exception.StudioValidationException;
import com.studiomanagement.booking.model.Booking;
import com.studiomanagement.booking.model.Client;
import com.studiomanagement.booking.model.EquipmentItem;
import com.studiomanagement.booking.model.Hall;
import com.studiomanagement.booking.repository.BookingRepository;
import com.studiomanagement.booking.service.lock.LockOperations;
import com.studiomanagement.booking.util.IdGenerator;
import com.studiomanagement.booking.validator.BookingValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The booking ledger. Sole owner and single mutation point of the booking collection.
 * Admission checks availability and inserts under one per-hall lock, so two conflicting
 * requests can never both be granted.
 */
@Service
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final CatalogService catalogService;
    private final ClientService clientService;
    private final AvailabilityService availabilityService;
    private final PricingService pricingService;
    private final LockOperations lockOperations;

    private final int minDurationHours;
    private final int maxDurationHours;

    public BookingService(
            BookingRepository bookingRepository,
            CatalogService catalogService,
            ClientService clientService,
            AvailabilityService availabilityService,
            PricingService pricingService,
            LockOperations lockOperations,
            @Value("${booking.min-duration-hours:" + BookingConstants.DEFAULT_MIN_DURATION_HOURS + "}") int minDurationHours,
            @Value("${booking.max-duration-hours:" + BookingConstants.DEFAULT_MAX_DURATION_HOURS + "}") int maxDurationHours) {
        BookingValidator.validateDurationBounds(minDurationHours, maxDurationHours);
        this.bookingRepository = bookingRepository;
        this.catalogService = catalogService;
        this.clientService = clientService;
        this.availabilityService = availabilityService;
        this.pricingService = pricingService;
        this.lockOperations = lockOperations;
        this.minDurationHours = minDurationHours;
        this.maxDurationHours = maxDurationHours;
    }

    // ========== Admission ==========

    /**
     * Grants the requested slot or refuses it. On refusal the ledger is left untouched.
     *
     * @throws StudioValidationException  malformed request, unknown references or invalid client phone
     * @throws HallNotAvailableException  the slot collides with a booking already held
     */
    public Booking admit(BookingRequest request) {
        BookingValidator.validateRequest(request, minDurationHours, maxDurationHours);

        log.info("Admitting booking: client={}, hall={}, date={}, time={}, duration={}h",
                request.getClientId(), request.getHallNumber(), request.getDate(),
                request.getStartTime(), request.getDurationHours());

        Client client = resolveClient(request.getClientId());
        Hall hall = resolveHall(request.getHallNumber());
        Set<EquipmentItem> equipment = resolveEquipment(request.getEquipmentNames());

        if (!clientService.validatePhone(client)) {
            log.warn("Rejected booking for client with invalid phone: client={}", client.getClientId());
            throw new StudioValidationException(ErrorCodes.INVALID_PHONE,
                    String.format(ValidationMessages.CLIENT_PHONE_INVALID, client.getPhone()));
        }

        return lockOperations.executeWithLock(hallResource(hall.getNumber()),
                () -> admitLocked(client, hall, equipment, request.getDate(),
                        request.getStartTime(), request.getDurationHours()));
    }

    private Booking admitLocked(Client client, Hall hall, Set<EquipmentItem> equipment,
                                LocalDate date, LocalTime time, int durationHours) {
        List<Booking> hallBookings = bookingRepository.findByHallNumber(hall.getNumber());

        Optional<Booking> conflict = availabilityService.findConflict(hallBookings, hall, date, time, durationHours);
        if (conflict.isPresent()) {
            log.warn("Hall not available: hall={}, date={}, time={}, conflictsWith={}",
                    hall.getNumber(), date, time, conflict.get().getBookingId());
            throw new HallNotAvailableException(hall.getNumber(), date, time);
        }

        BigDecimal cost = pricingService.computeCost(hall, equipment, durationHours, client.getDiscountPercent());

        Booking booking = Booking.builder()
                .bookingId(IdGenerator.generateBookingId())
                .client(client)
                .hall(hall)
                .equipment(equipment)
                .date(date)
                .startTime(time)
                .durationHours(durationHours)
                .cost(cost)
                .createdAt(LocalDateTime.now())
                .build();

        bookingRepository.save(booking);

        log.info("Booking admitted: id={}, hall={}, date={}, time={}, cost={}",
                booking.getBookingId(), hall.getNumber(), date, time, cost);
        return booking;
    }

    // ========== Cancellation ==========

    /**
     * Removes every booking held by the client.
     *
     * @return number of bookings removed, always positive
     * @throws ClientNotFoundException when the client holds no bookings; nothing is removed
     */
    public int cancel(String clientId) {
        if (!StringUtils.hasText(clientId)) {
            throw new StudioValidationException(ErrorCodes.UNKNOWN_CLIENT, ValidationMessages.CLIENT_ID_REQUIRED);
        }

        int removed = bookingRepository.deleteByClientId(clientId);
        if (removed == 0) {
            log.warn("Cancellation matched no bookings: client={}", clientId);
            throw ClientNotFoundException.noBookings(clientId);
        }

        log.info("Cancelled bookings: client={}, removed={}", clientId, removed);
        return removed;
    }

    // ========== Queries ==========

    /**
     * All bookings, dates ascending, insertion order kept within each date.
     */
    public List<Booking> list() {
        return listGroupedByDate().values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    public Map<LocalDate, List<Booking>> listGroupedByDate() {
        return bookingRepository.findAll().stream()
                .collect(Collectors.groupingBy(Booking::getDate, TreeMap::new, Collectors.toList()));
    }

    public List<Booking> findByClient(String clientId) {
        Client client = clientService.findById(clientId);
        return bookingRepository.findByClientId(client.getClientId());
    }

    public long count() {
        return bookingRepository.count();
    }

    /**
     * Highest hourly rate in the catalog. Ties go to the hall registered first.
     *
     * @throws NoHallsException when the catalog is empty
     */
    public Hall findMostExpensiveHall() {
        List<Hall> halls = catalogService.listHalls();
        if (halls.isEmpty()) {
            throw new NoHallsException();
        }

        Hall mostExpensive = halls.get(0);
        for (Hall hall : halls) {
            if (hall.getHourlyRate().compareTo(mostExpensive.getHourlyRate()) > 0) {
                mostExpensive = hall;
            }
        }
        return mostExpensive;
    }

    /**
     * Reports whether a slot is free right now, without reserving it.
     */
    public SlotState checkAvailability(int hallNumber, LocalDate date, LocalTime time, int durationHours) {
        if (date == null) {
            throw new StudioValidationException(ErrorCodes.INVALID_DATE, ValidationMessages.DATE_REQUIRED);
        }
        BookingValidator.validateStartTime(time);
        BookingValidator.validateDuration(durationHours, minDurationHours, maxDurationHours);

        Hall hall = resolveHall(hallNumber);
        return availabilityService.slotState(bookingRepository.findByHallNumber(hallNumber),
                hall, date, time, durationHours);
    }

    public BookingReport report() {
        List<Booking> bookings = bookingRepository.findAll();

        Map<Integer, Long> bookingsByHall = new LinkedHashMap<>();
        Map<Integer, BigDecimal> revenueByHall = new LinkedHashMap<>();
        BigDecimal totalRevenue = BigDecimal.ZERO;

        for (Booking booking : bookings) {
            int hallNumber = booking.getHall().getNumber();
            bookingsByHall.merge(hallNumber, 1L, Long::sum);
            revenueByHall.merge(hallNumber, booking.getCost(), BigDecimal::add);
            totalRevenue = totalRevenue.add(booking.getCost());
        }

        return BookingReport.builder()
                .totalBookings(bookings.size())
                .totalRevenue(totalRevenue)
                .bookingsByHall(bookingsByHall)
                .revenueByHall(revenueByHall)
                .build();
    }

    // ============ Private Methods ============

    private Client resolveClient(String clientId) {
        return clientService.find(clientId)
                .orElseThrow(() -> new StudioValidationException(ErrorCodes.UNKNOWN_CLIENT,
                        String.format(ValidationMessages.UNKNOWN_CLIENT, clientId)));
    }

    private Hall resolveHall(int hallNumber) {
        return catalogService.findHall(hallNumber)
                .orElseThrow(() -> new StudioValidationException(ErrorCodes.UNKNOWN_HALL,
                        String.format(ValidationMessages.UNKNOWN_HALL, hallNumber)));
    }

    private Set<EquipmentItem> resolveEquipment(List<String> names) {
        if (names == null || names.isEmpty()) {
            return Collections.emptySet();
        }

        Set<EquipmentItem> items = new LinkedHashSet<>();
        for (String name : names) {
            EquipmentItem item = catalogService.findEquipment(name)
                    .orElseThrow(() -> new StudioValidationException(ErrorCodes.UNKNOWN_EQUIPMENT,
                            String.format(ValidationMessages.UNKNOWN_EQUIPMENT, name)));
            items.add(item);
        }
        return Collections.unmodifiableSet(items);
    }

    private String hallResource(int hallNumber) {
        return BookingConstants.HALL_LOCK_PREFIX + hallNumber;
    }
}
