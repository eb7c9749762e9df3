package com.marketsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface AlertAcknowledgementRepository extends MongoRepository<AlertAcknowledgement, String> {
}
