package com.codeheadsystems.tether.server.store;

class InMemoryConnectionStoreTest extends ConnectionStoreContractTest {

  @Override
  protected ConnectionStore createStore() {
    return new InMemoryConnectionStore();
  }
}
