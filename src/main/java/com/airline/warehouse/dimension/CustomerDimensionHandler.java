package com.airline.warehouse.dimension;

import com.airline.warehouse.config.LoaderProperties;
import com.airline.warehouse.entity.CustomerDimension;
import com.airline.warehouse.entity.DimensionType;
import com.airline.warehouse.repository.CustomerDimensionRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Customers version on loyalty tier and email unless configured otherwise.
 */
@Component
public class CustomerDimensionHandler extends AbstractDimensionHandler<CustomerDimension> {

    static final List<String> DEFAULT_TRACKED = List.of("loyaltyTier", "email");

    public CustomerDimensionHandler(CustomerDimensionRepository repository, LoaderProperties properties) {
        super(DimensionType.CUSTOMER, CustomerDimension.class, repository, accessors(), DEFAULT_TRACKED, properties);
    }

    private static Map<String, Function<CustomerDimension, Object>> accessors() {
        Map<String, Function<CustomerDimension, Object>> accessors = new LinkedHashMap<>();
        accessors.put("firstName", CustomerDimension::getFirstName);
        accessors.put("lastName", CustomerDimension::getLastName);
        accessors.put("email", CustomerDimension::getEmail);
        accessors.put("phone", CustomerDimension::getPhone);
        accessors.put("loyaltyTier", CustomerDimension::getLoyaltyTier);
        accessors.put("loyaltyPoints", CustomerDimension::getLoyaltyPoints);
        accessors.put("joinDate", CustomerDimension::getJoinDate);
        accessors.put("country", CustomerDimension::getCountry);
        accessors.put("city", CustomerDimension::getCity);
        return accessors;
    }

    @Override
    protected CustomerDimension copyOf(CustomerDimension row) {
        return CustomerDimension.builder()
            .businessKey(row.getBusinessKey())
            .firstName(row.getFirstName())
            .lastName(row.getLastName())
            .email(row.getEmail())
            .phone(row.getPhone())
            .loyaltyTier(row.getLoyaltyTier())
            .loyaltyPoints(row.getLoyaltyPoints())
            .joinDate(row.getJoinDate())
            .country(row.getCountry())
            .city(row.getCity())
            .build();
    }
}
