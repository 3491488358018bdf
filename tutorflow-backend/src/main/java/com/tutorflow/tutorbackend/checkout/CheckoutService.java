package com.tutorflow.tutorbackend.checkout;

import com.tutorflow.tutorbackend.checkout.dto.CheckoutResult;
import com.tutorflow.tutorbackend.checkout.dto.CheckoutSession;
import com.tutorflow.tutorbackend.user.User;

public interface CheckoutService {
    CheckoutSession checkout(User user);
    CheckoutSession retryPayment(User user, String orderNumber);
    CheckoutResult confirmLocalPayment(User user, String orderNumber);
}
