package com.marketsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface RetrainRequestRepository extends MongoRepository<RetrainRequest, String> {

    boolean existsByModelIdAndStatus(String modelId, RetrainRequest.RetrainStatus status);

    List<RetrainRequest> findByStatusOrderByDeficitDesc(RetrainRequest.RetrainStatus status);
}
