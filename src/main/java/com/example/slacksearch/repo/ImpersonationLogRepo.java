package com.example.slacksearch.repo;

import com.example.slacksearch.model.ImpersonationLogEntry;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ImpersonationLogRepo extends MongoRepository<ImpersonationLogEntry, String> {}
