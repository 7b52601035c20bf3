package com.codehive.MPBS.Services;

import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Entities.Role;
import com.codehive.MPBS.Entities.Users;
import com.codehive.MPBS.Exceptions.DuplicateUsernameException;
import com.codehive.MPBS.Exceptions.ProtectedResourceException;
import com.codehive.MPBS.Exceptions.ResourceNotFoundException;
import com.codehive.MPBS.Repositories.ParkingBillRepository;
import com.codehive.MPBS.Repositories.UserRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AdminServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-10T09:30:00Z"), ZoneOffset.UTC);

    @Mock
    private UserRepository userRepository;

    @Mock
    private ParkingBillRepository parkingBillRepository;

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private AdminService adminService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(adminService, "clock", CLOCK);
    }

    private static Users user(String id, String username, Role role, boolean primaryAdmin) {
        Users user = new Users();
        user.setId(id);
        user.setUsername(username);
        user.setRole(role);
        user.setPrimaryAdmin(primaryAdmin);
        return user;
    }

    // --- Users ---

    @Test
    void addUser_Success() {
        // Arrange
        when(userRepository.existsByUsername("operator1")).thenReturn(false);
        when(passwordEncoder.encode("secret")).thenReturn("$2a$hash");
        when(userRepository.insert(any(Users.class))).thenAnswer(i -> i.getArguments()[0]);

        // Act
        Users created = adminService.addUser(" operator1 ", "secret", Role.OPERATOR);

        // Assert
        assertEquals("operator1", created.getUsername());
        assertEquals("$2a$hash", created.getPassword());
        assertEquals(Role.OPERATOR, created.getRole());
        assertFalse(created.isPrimaryAdmin());
        assertNotNull(created.getCreatedAt());
    }

    @Test
    void addUser_DuplicateUsername_ShouldFail() {
        when(userRepository.existsByUsername("operator1")).thenReturn(true);

        assertThrows(DuplicateUsernameException.class,
                () -> adminService.addUser("operator1", "secret", Role.OPERATOR));

        verify(userRepository, never()).insert(any(Users.class));
    }

    @Test
    void addUser_ConcurrentDuplicate_ShouldFail() {
        // Arrange: the unique username index rejects the second insert
        when(userRepository.existsByUsername("operator1")).thenReturn(false);
        when(passwordEncoder.encode("secret")).thenReturn("$2a$hash");
        when(userRepository.insert(any(Users.class))).thenThrow(new DuplicateKeyException("E11000"));

        // Act & Assert
        DuplicateUsernameException exception = assertThrows(DuplicateUsernameException.class,
                () -> adminService.addUser("operator1", "secret", Role.OPERATOR));
        assertEquals("Username already exists!", exception.getMessage());
    }

    @Test
    void deleteUser_PrimaryAdmin_ShouldFail() {
        when(userRepository.findById("u1")).thenReturn(Optional.of(user("u1", "admin", Role.ADMIN, true)));

        ProtectedResourceException exception = assertThrows(ProtectedResourceException.class,
                () -> adminService.deleteUser("u1"));

        assertEquals("Cannot delete primary admin!", exception.getMessage());
        verify(userRepository, never()).delete(any(Users.class));
    }

    @Test
    void deleteUser_SecondAdmin_Success() {
        // Only the primary admin is protected, not every ADMIN
        Users secondAdmin = user("u2", "manager", Role.ADMIN, false);
        when(userRepository.findById("u2")).thenReturn(Optional.of(secondAdmin));

        adminService.deleteUser("u2");

        verify(userRepository).delete(secondAdmin);
    }

    @Test
    void deleteUser_NotFound_ShouldFail() {
        when(userRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> adminService.deleteUser("missing"));
        verify(userRepository, never()).delete(any(Users.class));
    }

    // --- Bills ---

    @Test
    void listBills_UsesNewestFirstPages() {
        // Arrange
        Page<ParkingBill> page = new PageImpl<>(Collections.emptyList());
        when(parkingBillRepository.findAll(any(Pageable.class))).thenReturn(page);
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);

        // Act
        Page<ParkingBill> result = adminService.listBills(3);

        // Assert
        assertSame(page, result);
        verify(parkingBillRepository).findAll(captor.capture());
        Pageable pageable = captor.getValue();
        assertEquals(2, pageable.getPageNumber());
        assertEquals(AdminService.BILLS_PAGE_SIZE, pageable.getPageSize());
        assertEquals(Sort.Direction.DESC, pageable.getSort().getOrderFor("billDate").getDirection());
    }

    @Test
    void listBills_PageBelowOne_ReturnsFirstPage() {
        when(parkingBillRepository.findAll(any(Pageable.class))).thenReturn(new PageImpl<>(Collections.emptyList()));
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);

        adminService.listBills(0);

        verify(parkingBillRepository).findAll(captor.capture());
        assertEquals(0, captor.getValue().getPageNumber());
    }

    @Test
    void search_EmptyQuery_ReturnsNothing() {
        assertTrue(adminService.search("").isEmpty());
        assertTrue(adminService.search(null).isEmpty());

        verifyNoInteractions(mongoTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void search_MatchesThreeFieldsCaseInsensitive() {
        // Arrange
        ParkingBill bill = new ParkingBill();
        bill.setSlotNumber("SLOT-01");
        when(mongoTemplate.find(any(Query.class), eq(ParkingBill.class))).thenReturn(List.of(bill));
        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);

        // Act
        List<ParkingBill> result = adminService.search("slot-01");

        // Assert
        assertEquals(1, result.size());
        verify(mongoTemplate).find(captor.capture(), eq(ParkingBill.class));
        Query query = captor.getValue();

        List<Document> alternatives = (List<Document>) query.getQueryObject().get("$or");
        assertEquals(3, alternatives.size());
        assertTrue(alternatives.get(0).containsKey("customerName"));
        assertTrue(alternatives.get(1).containsKey("vehicleNumber"));
        assertTrue(alternatives.get(2).containsKey("slotNumber"));

        assertEquals(AdminService.SEARCH_LIMIT, query.getLimit());
        assertEquals(-1, query.getSortObject().get("billDate"));
    }
}
