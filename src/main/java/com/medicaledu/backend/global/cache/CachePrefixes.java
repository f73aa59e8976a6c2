package com.medicaledu.backend.global.cache;

/**
 * Cache key prefixes. Queries build their keys from these and commands name them in
 * {@link CacheInvalidation}.
 */
public final class CachePrefixes {

    public static final String GET_ALL_COURSES = "GetAllCourses";
    public static final String GET_COURSE_BY_ID = "GetCourseById";
    public static final String GET_COURSES_BY_INSTRUCTOR = "GetCoursesByInstructor";
    public static final String GET_COURSES_BY_CATEGORY = "GetCoursesByCategory";

    public static final String GET_ALL_USERS = "GetAllUsers";
    public static final String GET_USER_BY_ID = "GetUserById";
    public static final String GET_USERS_BY_ROLE = "GetUsersByRole";

    public static final String GET_ENROLLMENTS = "GetEnrollments";
    public static final String GET_ENROLLMENTS_BY_USER = "GetEnrollmentsByUser";
    public static final String GET_ENROLLMENTS_BY_COURSE = "GetEnrollmentsByCourse";

    public static final String GET_BOOKINGS = "GetBookings";
    public static final String GET_BOOKINGS_BY_USER = "GetBookingsByUser";
    public static final String GET_BOOKINGS_BY_INSTRUCTOR = "GetBookingsByInstructor";

    public static final String GET_AVAILABILITY_SLOTS = "GetAvailabilitySlots";
    public static final String GET_AVAILABILITY_SLOTS_BY_INSTRUCTOR = "GetAvailabilitySlotsByInstructor";

    public static final String GET_PAYMENTS = "GetPayments";
    public static final String GET_PAYMENTS_BY_USER = "GetPaymentsByUser";

    public static final String GET_COURSE_RATINGS = "GetCourseRatings";
    public static final String GET_INSTRUCTOR_RATINGS = "GetInstructorRatings";

    public static final String GET_NOTIFICATIONS = "GetNotifications";
    public static final String GET_NOTIFICATIONS_BY_USER = "GetNotificationsByUser";

    public static final String GET_PROMO_CODES = "GetPromoCodes";
    public static final String GET_AUDIT_LOGS = "GetAuditLogs";

    private CachePrefixes() {
    }

    public static String key(String prefix, Object discriminator) {
        return prefix + "_" + discriminator;
    }
}
