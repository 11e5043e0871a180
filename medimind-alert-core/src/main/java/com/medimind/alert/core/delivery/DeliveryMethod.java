package com.medimind.alert.core.delivery;

import java.util.List;

/** Delivery method tags understood by the default escalation paths. */
public final class DeliveryMethod {
    public static final String PUSH_NOTIFICATION = "push_notification";
    public static final String SMS = "sms";
    public static final String EMAIL = "email";
    public static final String PHONE_CALL = "phone_call";
    public static final String EMERGENCY_SERVICES = "emergency_services";
    public static final String IN_APP_NOTIFICATION = "in_app_notification";

    public static final List<String> KNOWN =
            List.of(PUSH_NOTIFICATION, SMS, EMAIL, PHONE_CALL, EMERGENCY_SERVICES, IN_APP_NOTIFICATION);

    private DeliveryMethod() {}
}
